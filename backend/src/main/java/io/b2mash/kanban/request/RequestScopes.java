package io.b2mash.kanban.request;

import java.util.Optional;
import java.util.UUID;

/**
 * Per-request caller identity, bound by {@link MemberContextFilter} and read by the audit trail.
 * Authentication happens upstream; the member id is trusted as given.
 */
public final class RequestScopes {

  private static final ThreadLocal<UUID> MEMBER_ID = new ThreadLocal<>();

  private RequestScopes() {}

  /** Returns the calling member's id, or empty for internal (non-request) work. */
  public static Optional<UUID> currentMemberId() {
    return Optional.ofNullable(MEMBER_ID.get());
  }

  static void bindMemberId(UUID memberId) {
    MEMBER_ID.set(memberId);
  }

  static void clear() {
    MEMBER_ID.remove();
  }
}
