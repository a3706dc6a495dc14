package com.gnovoa.matchsim.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * All tunable simulation parameters, bound from {@code sim.*}.
 *
 * <p>The engine classes take the nested records directly so they can be built without Spring;
 * {@link #defaults()} gives the same values as the shipped {@code application.yml}.
 */
@ConfigurationProperties(prefix = "sim")
public record SimProperties(
    int tickMillis,
    int maxTraceEvents,
    Match match,
    Probability probability,
    Energy energy,
    Discipline discipline,
    Substitution substitution,
    Rosters rosters,
    Retention retention) {

  public SimProperties {
    if (tickMillis <= 0) tickMillis = 1000;
    if (maxTraceEvents <= 0) maxTraceEvents = 5000;
    if (match == null) match = Match.defaults();
    if (probability == null) probability = Probability.defaults();
    if (energy == null) energy = Energy.defaults();
    if (discipline == null) discipline = Discipline.defaults();
    if (substitution == null) substitution = Substitution.defaults();
    if (rosters == null) rosters = new Rosters(List.of());
    if (retention == null) retention = Retention.defaults();
  }

  public static SimProperties defaults() {
    return new SimProperties(1000, 5000, null, null, null, null, null, null, null);
  }

  /** Clock layout. Stoppage minutes are drawn once at kickoff from the match RNG. */
  public record Match(int halfTimeMinute, int regulationMinutes, int stoppageMin, int stoppageMax) {
    public static Match defaults() {
      return new Match(45, 90, 1, 5);
    }
  }

  /**
   * @param postureStrengthBonus team strength added when attacking and removed when defensive
   * @param cornerShare share of set pieces that are corners, the rest are free kicks
   * @param keeperEdgeFactor open-play conversion lost per point of goalkeeping above 70, per 100
   * @param missingKeeperEdge keeper edge used when the defending side has no goalkeeper
   * @param injuryFatigueScale energy deficit that adds one unit of injury weight
   */
  public record Probability(
      double eventPerMinute,
      int lateGameMinute,
      double lateGameBonus,
      double closeScoreBonus,
      double creationTriggerWeight,
      double homePossessionBonus,
      double possessionMin,
      double possessionMax,
      double chanceWeight,
      double cardWeight,
      double setPieceWeight,
      double saveWeight,
      double injuryWeight,
      double trailingChanceBias,
      double penaltyShare,
      double ownGoalShare,
      double offsideShare,
      double baseConversion,
      double strengthConversionFactor,
      double finishingConversionFactor,
      double minConversion,
      double maxConversion,
      double homeConversionBonus,
      double saveShareOfMisses,
      double cornerGoalRate,
      double freeKickGoalRate,
      double assistProbability,
      double redCardStrengthPenalty,
      double postureStrengthBonus,
      double cornerShare,
      double keeperEdgeFactor,
      double missingKeeperEdge,
      double injuryFatigueScale,
      double penaltyBaseConversion,
      double penaltyTakerFactor,
      double penaltyKeeperFactor,
      double minPenaltyConversion,
      double maxPenaltyConversion) {

    public static Probability defaults() {
      return new Probability(
          0.15, 75, 0.03, 0.02, 0.25, 0.04, 0.2, 0.8,
          0.40, 0.18, 0.14, 0.08, 0.03, 0.15,
          0.06, 0.03, 0.10,
          0.30, 0.2, 0.1, 0.05, 0.6, 0.05, 0.45,
          0.03, 0.05, 0.7, 8.0,
          3.0, 0.55, 0.1, -0.1, 25.0,
          0.76, 0.5, 0.35, 0.55, 0.92);
    }
  }

  /**
   * @param postureDrainShift extra drain for the line the posture leans on (attackers when
   *     attacking, defenders when defensive), and the relief for the opposite line
   * @param injuryEnergyCap live energy an injured player is knocked down to, at most
   */
  public record Energy(
      double baseDrainPerMinute,
      int lateMatchMinute,
      double lateMatchMultiplier,
      double goalkeeperMultiplier,
      double postureDrainShift,
      double injuryEnergyCap) {

    public static Energy defaults() {
      return new Energy(0.35, 60, 1.15, 0.6, 0.2, 30.0);
    }
  }

  public record Discipline(
      double aggressionWeight,
      double composureWeight,
      double energyDeficitWeight,
      double bookingWeight,
      double latenessWeight,
      double directRedBase,
      double directRedMax,
      double goalkeeperFoulFactor) {

    public static Discipline defaults() {
      return new Discipline(1.0, 0.8, 0.6, 0.5, 0.4, 0.02, 0.15, 0.25);
    }
  }

  public record Substitution(
      int maxSubs,
      int maxPerMinute,
      int earliestMinute,
      double fatigueThreshold,
      double minEnergyGain,
      int protectLeadFromMinute,
      int protectLeadMargin,
      int protectLeadMaxSubs,
      int tacticalFromMinute,
      int tacticalMinDelta) {

    public static Substitution defaults() {
      return new Substitution(5, 3, 46, 45.0, 20.0, 70, 1, 2, 60, 5);
    }
  }

  /** Roster resource locations, e.g. {@code classpath:rosters/demo-league.json}. */
  public record Rosters(List<String> files) {
    public Rosters {
      files = files == null ? List.of() : List.copyOf(files);
    }
  }

  /**
   * @param maxFinishedMatches finished matches kept for inspection; the oldest are dropped past
   *     this count, live matches are never dropped
   */
  public record Retention(int maxFinishedMatches) {
    public Retention {
      if (maxFinishedMatches < 0) {
        throw new IllegalArgumentException("maxFinishedMatches must not be negative");
      }
    }

    public static Retention defaults() {
      return new Retention(200);
    }
  }
}
