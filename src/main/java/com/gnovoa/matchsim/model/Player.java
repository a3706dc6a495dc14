package com.gnovoa.matchsim.model;

/**
 * A roster player. Immutable during a match; live values (energy, bookings) are kept as overlays
 * in the match state.
 *
 * @param energy baseline energy (0-100) the player brings into the match
 */
public record Player(
    String playerId,
    String name,
    String nickname,
    int age,
    Position position,
    PlayerAttributes attributes,
    int energy) {

  public String displayName() {
    return nickname == null || nickname.isBlank() ? name : nickname;
  }
}
