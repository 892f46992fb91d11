package com.scholary.aijobs.faceswap;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/** In-memory listing store backed by a size-bounded Caffeine cache. */
@Repository
public class InMemoryListingStore implements ListingStore {

  private final Cache<String, Listing> listings;
  private final Clock clock;

  public InMemoryListingStore(@Value("${listings.store.maxSize}") int maxSize, Clock clock) {
    this.clock = clock;
    this.listings = Caffeine.newBuilder().maximumSize(maxSize).build();
  }

  @Override
  public Optional<Listing> findById(String listingId) {
    return Optional.ofNullable(listings.getIfPresent(listingId));
  }

  @Override
  public void save(Listing listing) {
    listings.put(listing.id(), listing);
  }

  @Override
  public Listing updateDisplayImage(String listingId, String displayImageUrl) {
    Listing updated =
        listings
            .asMap()
            .computeIfPresent(
                listingId, (id, current) -> current.withDisplayImage(displayImageUrl, clock.instant()));
    if (updated == null) {
      throw new ListingNotFoundException(listingId);
    }
    return updated;
  }
}
