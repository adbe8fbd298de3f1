package io.b2mash.b2b.inteltask.collectionpoint;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CollectionPointRepository extends JpaRepository<CollectionPoint, UUID> {

  @Query(
      """
      SELECT p FROM CollectionPoint p
      WHERE p.id IN :ids AND p.active = true
      ORDER BY p.code ASC
      """)
  List<CollectionPoint> findActiveByIds(@Param("ids") Collection<UUID> ids);

  @Query(
      """
      SELECT p FROM CollectionPoint p
      WHERE p.type IN :types AND p.active = true
      ORDER BY p.code ASC
      """)
  List<CollectionPoint> findActiveByTypes(@Param("types") Collection<String> types);
}
