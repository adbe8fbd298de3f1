package io.b2mash.b2b.inteltask.collectionpoint;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Assigns a user to a collection point. A null commodity means the user covers every commodity the
 * point handles.
 */
@Entity
@Table(name = "collection_point_allocations")
public class CollectionPointAllocation {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "collection_point_id", nullable = false)
  private UUID collectionPointId;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(name = "commodity", length = 100)
  private String commodity;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected CollectionPointAllocation() {}

  public CollectionPointAllocation(UUID collectionPointId, UUID userId, String commodity) {
    this.collectionPointId = collectionPointId;
    this.userId = userId;
    this.commodity = commodity;
    this.active = true;
    this.createdAt = Instant.now();
  }

  public void deactivate() {
    this.active = false;
  }

  public UUID getId() {
    return id;
  }

  public UUID getCollectionPointId() {
    return collectionPointId;
  }

  public UUID getUserId() {
    return userId;
  }

  public String getCommodity() {
    return commodity;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
