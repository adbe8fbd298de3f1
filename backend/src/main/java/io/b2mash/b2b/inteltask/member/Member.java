package io.b2mash.b2b.inteltask.member;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Directory entry for a user who can receive tasks. Organisation and department are read at
 * instantiation time and copied onto each task.
 */
@Entity
@Table(name = "members")
public class Member {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "organization_id")
  private UUID organizationId;

  @Column(name = "department_id")
  private UUID departmentId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private MemberStatus status;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Member() {}

  public Member(String name, UUID organizationId, UUID departmentId) {
    this.name = name;
    this.organizationId = organizationId;
    this.departmentId = departmentId;
    this.status = MemberStatus.ACTIVE;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Moves the member to another unit. Tasks already issued keep their snapshot. */
  public void reassign(UUID organizationId, UUID departmentId) {
    this.organizationId = organizationId;
    this.departmentId = departmentId;
    this.updatedAt = Instant.now();
  }

  public void disable() {
    this.status = MemberStatus.DISABLED;
    this.updatedAt = Instant.now();
  }

  public boolean isActive() {
    return status == MemberStatus.ACTIVE;
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public UUID getOrganizationId() {
    return organizationId;
  }

  public UUID getDepartmentId() {
    return departmentId;
  }

  public MemberStatus getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
