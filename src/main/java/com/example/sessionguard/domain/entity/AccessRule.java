package com.example.sessionguard.domain.entity;

/**
 * One entry of the access policy.
 *
 * @param pattern     Ant-style path pattern ({@code *}, {@code **}, {@code ?})
 * @param requirement what the matched path requires
 * @param target      redirect target for requirements that carry one, otherwise {@code null}
 */
public record AccessRule(
    String pattern,
    AccessRequirement requirement,
    String target
) {

  public static AccessRule of(String pattern, AccessRequirement requirement) {
    return new AccessRule(pattern, requirement, null);
  }

  public static AccessRule of(String pattern, AccessRequirement requirement, String target) {
    return new AccessRule(pattern, requirement, target);
  }
}
