package io.b2mash.b2b.inteltask.collectionpoint;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CollectionPointAllocationRepository
    extends JpaRepository<CollectionPointAllocation, UUID> {

  @Query(
      """
      SELECT a FROM CollectionPointAllocation a
      WHERE a.collectionPointId IN :pointIds AND a.active = true
      ORDER BY a.createdAt ASC
      """)
  List<CollectionPointAllocation> findActiveByPointIds(
      @Param("pointIds") Collection<UUID> pointIds);
}
