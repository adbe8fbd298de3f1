package io.b2mash.b2b.inteltask.collectionpoint;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "collection_points")
public class CollectionPoint {

  private static final int DEFAULT_DISPATCH_MINUTE = 540;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "code", nullable = false, length = 100)
  private String code;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "type", nullable = false, length = 50)
  private String type;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "commodities", columnDefinition = "jsonb")
  private List<String> commodities = new ArrayList<>();

  @Column(name = "active", nullable = false)
  private boolean active;

  @Enumerated(EnumType.STRING)
  @Column(name = "frequency_type", nullable = false, length = 20)
  private PointFrequencyType frequencyType;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "weekdays", columnDefinition = "jsonb")
  private List<Integer> weekdays = new ArrayList<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "month_days", columnDefinition = "jsonb")
  private List<Integer> monthDays = new ArrayList<>();

  @Column(name = "dispatch_at_minute", nullable = false)
  private int dispatchAtMinute;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected CollectionPoint() {}

  public CollectionPoint(String code, String name, String type, List<String> commodities) {
    this.code = code;
    this.name = name;
    this.type = type;
    this.commodities = commodities != null ? new ArrayList<>(commodities) : new ArrayList<>();
    this.active = true;
    this.frequencyType = PointFrequencyType.DAILY;
    this.dispatchAtMinute = DEFAULT_DISPATCH_MINUTE;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Replaces the point's own dispatch schedule used by point-default templates. */
  public void updateSchedule(
      PointFrequencyType frequencyType,
      List<Integer> weekdays,
      List<Integer> monthDays,
      int dispatchAtMinute) {
    this.frequencyType = frequencyType != null ? frequencyType : PointFrequencyType.DAILY;
    this.weekdays = weekdays != null ? new ArrayList<>(weekdays) : new ArrayList<>();
    this.monthDays = monthDays != null ? new ArrayList<>(monthDays) : new ArrayList<>();
    this.dispatchAtMinute = dispatchAtMinute;
    this.updatedAt = Instant.now();
  }

  public void deactivate() {
    this.active = false;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getCode() {
    return code;
  }

  public String getName() {
    return name;
  }

  public String getType() {
    return type;
  }

  public List<String> getCommodities() {
    return commodities != null ? commodities : List.of();
  }

  public boolean isActive() {
    return active;
  }

  public PointFrequencyType getFrequencyType() {
    return frequencyType;
  }

  public List<Integer> getWeekdays() {
    return weekdays != null ? weekdays : List.of();
  }

  public List<Integer> getMonthDays() {
    return monthDays != null ? monthDays : List.of();
  }

  public int getDispatchAtMinute() {
    return dispatchAtMinute;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
