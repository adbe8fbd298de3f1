package io.b2mash.b2b.inteltask.member;

public enum MemberStatus {
  ACTIVE,
  DISABLED
}
