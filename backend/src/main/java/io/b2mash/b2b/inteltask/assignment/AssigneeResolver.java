package io.b2mash.b2b.inteltask.assignment;

import io.b2mash.b2b.inteltask.collectionpoint.CollectionPoint;
import io.b2mash.b2b.inteltask.collectionpoint.CollectionPointAllocation;
import io.b2mash.b2b.inteltask.collectionpoint.CollectionPointAllocationRepository;
import io.b2mash.b2b.inteltask.collectionpoint.CollectionPointRepository;
import io.b2mash.b2b.inteltask.member.MemberRepository;
import io.b2mash.b2b.inteltask.template.AssigneeMode;
import io.b2mash.b2b.inteltask.template.TaskTemplate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.springframework.stereotype.Service;

/**
 * Turns a template's distribution configuration into concrete recipients. Resolution never fails
 * on configuration: an empty result is a valid outcome and means no tasks are issued.
 */
@Service
public class AssigneeResolver {

  private final MemberRepository memberRepository;
  private final CollectionPointRepository collectionPointRepository;
  private final CollectionPointAllocationRepository allocationRepository;

  public AssigneeResolver(
      MemberRepository memberRepository,
      CollectionPointRepository collectionPointRepository,
      CollectionPointAllocationRepository allocationRepository) {
    this.memberRepository = memberRepository;
    this.collectionPointRepository = collectionPointRepository;
    this.allocationRepository = allocationRepository;
  }

  /**
   * Resolves the distinct user ids a template distributes to, in resolution order. A non-empty
   * override list is returned as-is (deduplicated) and skips every other source.
   */
  public List<UUID> resolveAssignees(TaskTemplate template, List<UUID> overrideIds) {
    if (overrideIds != null && !overrideIds.isEmpty()) {
      return List.copyOf(new LinkedHashSet<>(overrideIds));
    }

    Set<UUID> targets = new LinkedHashSet<>(template.getAssigneeIds());
    AssigneeMode mode = template.getAssigneeMode();

    if (mode == AssigneeMode.BY_DEPARTMENT && !template.getDepartmentIds().isEmpty()) {
      targets.addAll(memberRepository.findActiveIdsByDepartmentIds(template.getDepartmentIds()));
    }
    if (mode == AssigneeMode.BY_ORGANIZATION && !template.getOrganizationIds().isEmpty()) {
      targets.addAll(
          memberRepository.findActiveIdsByOrganizationIds(template.getOrganizationIds()));
    }
    if (mode == AssigneeMode.ALL_ACTIVE) {
      targets.addAll(memberRepository.findAllActiveIds());
    }
    if (mode == AssigneeMode.BY_COLLECTION_POINT) {
      var pointIds = new LinkedHashSet<UUID>();
      if (template.getCollectionPointId() != null) {
        pointIds.add(template.getCollectionPointId());
      }
      pointIds.addAll(template.getCollectionPointIds());
      if (!pointIds.isEmpty()) {
        allocationRepository.findActiveByPointIds(pointIds).stream()
            .map(CollectionPointAllocation::getUserId)
            .forEach(targets::add);
      }
    }

    return List.copyOf(targets);
  }

  /** Active points explicitly listed on the template. */
  public List<CollectionPoint> resolveTemplatePoints(TaskTemplate template) {
    return resolvePointsByIds(template.listedPointIds());
  }

  public List<CollectionPoint> resolvePointsByIds(Collection<UUID> pointIds) {
    if (pointIds == null || pointIds.isEmpty()) {
      return List.of();
    }
    return collectionPointRepository.findActiveByIds(pointIds);
  }

  /** Every active point whose type is one of {@code types}. */
  public List<CollectionPoint> resolvePointsByType(Collection<String> types) {
    if (types == null || types.isEmpty()) {
      return List.of();
    }
    return collectionPointRepository.findActiveByTypes(types);
  }

  /** Loads the active allocations of {@code points} and expands them into targets. */
  public List<AssignmentTarget> resolvePointTargets(List<CollectionPoint> points) {
    if (points.isEmpty()) {
      return List.of();
    }
    var pointIds = points.stream().map(CollectionPoint::getId).toList();
    return expandAllocations(points, allocationRepository.findActiveByPointIds(pointIds));
  }

  /**
   * Expands allocations into (user, point, commodity) targets, in point order then allocation
   * order. An allocation without a commodity covers every commodity of its point, or yields a
   * single unscoped target when the point lists none. Duplicate triples are dropped.
   */
  public static List<AssignmentTarget> expandAllocations(
      List<CollectionPoint> points, List<CollectionPointAllocation> allocations) {
    Map<UUID, List<CollectionPointAllocation>> byPoint = new LinkedHashMap<>();
    for (var allocation : allocations) {
      byPoint
          .computeIfAbsent(allocation.getCollectionPointId(), id -> new ArrayList<>())
          .add(allocation);
    }

    Set<AssignmentTarget> targets = new LinkedHashSet<>();
    for (var point : points) {
      for (var allocation : byPoint.getOrDefault(point.getId(), List.of())) {
        for (String commodity : commoditiesFor(point, allocation)) {
          targets.add(new AssignmentTarget(allocation.getUserId(), point.getId(), commodity));
        }
      }
    }
    return List.copyOf(targets);
  }

  static List<String> commoditiesFor(CollectionPoint point, CollectionPointAllocation allocation) {
    if (allocation.getCommodity() != null) {
      return List.of(allocation.getCommodity());
    }
    if (point.getCommodities().isEmpty()) {
      var unscoped = new ArrayList<String>(1);
      unscoped.add(null);
      return unscoped;
    }
    return point.getCommodities();
  }
}
