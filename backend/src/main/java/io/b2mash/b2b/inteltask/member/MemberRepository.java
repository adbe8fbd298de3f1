package io.b2mash.b2b.inteltask.member;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MemberRepository extends JpaRepository<Member, UUID> {

  @Query(
      """
      SELECT m.id FROM Member m
      WHERE m.status = io.b2mash.b2b.inteltask.member.MemberStatus.ACTIVE
        AND m.departmentId IN :departmentIds
      ORDER BY m.createdAt ASC
      """)
  List<UUID> findActiveIdsByDepartmentIds(@Param("departmentIds") Collection<UUID> departmentIds);

  @Query(
      """
      SELECT m.id FROM Member m
      WHERE m.status = io.b2mash.b2b.inteltask.member.MemberStatus.ACTIVE
        AND m.organizationId IN :organizationIds
      ORDER BY m.createdAt ASC
      """)
  List<UUID> findActiveIdsByOrganizationIds(
      @Param("organizationIds") Collection<UUID> organizationIds);

  @Query(
      """
      SELECT m.id FROM Member m
      WHERE m.status = io.b2mash.b2b.inteltask.member.MemberStatus.ACTIVE
      ORDER BY m.createdAt ASC
      """)
  List<UUID> findAllActiveIds();

  List<Member> findByIdIn(Collection<UUID> ids);
}
