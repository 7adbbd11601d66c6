package com.yahtzeegame.scoring;

import java.util.Objects;

/**
 * A named scoring box. Categories are shared, immutable definitions; a scoresheet
 * only refers to them by id.
 */
public final class Category {

    /**
     * How a category turns a roll into points.
     */
    public enum Kind {
        /** Sum of the dice showing one face value (Ones to Sixes). */
        FACE,
        /** Sum of all dice when the pattern holds (Three/Four of a Kind, Chance). */
        TOTAL,
        /** Constant points when the pattern holds (Full House, straights, Yahtzee). */
        FIXED
    }

    private final String id;
    private final String displayName;
    private final Section section;
    private final Kind kind;
    private final int faceValue;
    private final Pattern pattern;
    private final int points;

    private Category(String id, String displayName, Section section, Kind kind,
                     int faceValue, Pattern pattern, int points) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Category id must not be blank");
        }
        this.id = id;
        this.displayName = displayName == null ? id : displayName;
        this.section = Objects.requireNonNull(section, "section");
        this.kind = kind;
        this.faceValue = faceValue;
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.points = points;
    }

    public static Category face(String id, String displayName, int faceValue) {
        if (faceValue < Roll.MIN_FACE || faceValue > Roll.MAX_FACE) {
            throw new IllegalArgumentException("Face value must be between 1 and 6: " + faceValue);
        }
        return new Category(id, displayName, Section.UPPER, Kind.FACE, faceValue, Pattern.ANY, 0);
    }

    public static Category total(String id, String displayName, Pattern pattern) {
        return new Category(id, displayName, Section.LOWER, Kind.TOTAL, 0, pattern, 0);
    }

    public static Category fixed(String id, String displayName, Pattern pattern, int points) {
        if (points < 0) {
            throw new IllegalArgumentException("Points must not be negative: " + points);
        }
        return new Category(id, displayName, Section.LOWER, Kind.FIXED, 0, pattern, points);
    }

    /**
     * Whether the roll has the shape this category asks for. Face categories accept
     * any roll.
     */
    public boolean isSatisfiedBy(Roll roll) {
        return pattern.matches(roll);
    }

    /**
     * Points for the roll under the normal rules; zero when the pattern is missing.
     */
    public int score(Roll roll) {
        return switch (kind) {
            case FACE -> roll.sumOf(faceValue);
            case TOTAL -> isSatisfiedBy(roll) ? roll.sum() : 0;
            case FIXED -> isSatisfiedBy(roll) ? points : 0;
        };
    }

    /**
     * Points for a joker roll: lower-section boxes score as if their pattern held,
     * face boxes score normally.
     */
    public int jokerScore(Roll roll) {
        return switch (kind) {
            case FACE -> roll.sumOf(faceValue);
            case TOTAL -> roll.sum();
            case FIXED -> points;
        };
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Section getSection() {
        return section;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Face value for {@link Kind#FACE} categories, 0 otherwise.
     */
    public int getFaceValue() {
        return faceValue;
    }

    public Pattern getPattern() {
        return pattern;
    }

    /**
     * Constant award for {@link Kind#FIXED} categories, 0 otherwise.
     */
    public int getPoints() {
        return points;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Category)) return false;
        Category other = (Category) o;
        return faceValue == other.faceValue
                && points == other.points
                && id.equals(other.id)
                && section == other.section
                && kind == other.kind
                && pattern == other.pattern;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, section, kind, faceValue, pattern, points);
    }

    @Override
    public String toString() {
        return id;
    }
}
