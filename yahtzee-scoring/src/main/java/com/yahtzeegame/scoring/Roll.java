package com.yahtzeegame.scoring;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable snapshot of five die faces. Order does not matter: two rolls with the
 * same faces are equal no matter how the dice were rolled or held.
 */
public final class Roll {

    public static final int DICE = 5;
    public static final int MIN_FACE = 1;
    public static final int MAX_FACE = 6;

    // sorted ascending
    private final int[] faces;
    // counts[face], index 0 unused
    private final int[] counts;

    private Roll(int[] faces) {
        this.faces = faces;
        this.counts = new int[MAX_FACE + 1];
        for (int face : faces) {
            counts[face]++;
        }
    }

    /**
     * Create a roll from exactly five faces in 1..6.
     *
     * @throws InvalidRollException if the count or any face is out of range
     */
    public static Roll of(int... faces) {
        if (faces == null || faces.length != DICE) {
            throw new InvalidRollException("A roll needs exactly " + DICE + " dice, got "
                    + (faces == null ? "none" : String.valueOf(faces.length)));
        }
        int[] sorted = faces.clone();
        for (int i = 0; i < sorted.length; i++) {
            checkFace(sorted[i], i);
        }
        Arrays.sort(sorted);
        return new Roll(sorted);
    }

    public static Roll of(List<Integer> faces) {
        if (faces == null) {
            throw new InvalidRollException("A roll needs exactly " + DICE + " dice, got none");
        }
        int[] values = new int[faces.size()];
        for (int i = 0; i < values.length; i++) {
            Integer face = faces.get(i);
            if (face == null) {
                throw new InvalidRollException("Die " + (i + 1) + " has no face value");
            }
            values[i] = face;
        }
        return of(values);
    }

    private static void checkFace(int face, int index) {
        if (face < MIN_FACE || face > MAX_FACE) {
            throw new InvalidRollException(String.format(
                    "Die %d shows %d, faces must be between %d and %d", index + 1, face, MIN_FACE, MAX_FACE));
        }
    }

    public List<Integer> getFaces() {
        List<Integer> result = new ArrayList<>(DICE);
        for (int face : faces) {
            result.add(face);
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Number of dice showing the given face; 0 for faces outside 1..6.
     */
    public int count(int face) {
        if (face < MIN_FACE || face > MAX_FACE) {
            return 0;
        }
        return counts[face];
    }

    /**
     * Histogram of the roll, indexed by face value (index 0 is always 0).
     */
    public int[] counts() {
        return counts.clone();
    }

    public int maxCount() {
        int max = 0;
        for (int count : counts) {
            max = Math.max(max, count);
        }
        return max;
    }

    public Set<Integer> distinctFaces() {
        Set<Integer> distinct = new TreeSet<>();
        for (int face : faces) {
            distinct.add(face);
        }
        return Collections.unmodifiableSet(distinct);
    }

    public int sum() {
        int total = 0;
        for (int face : faces) {
            total += face;
        }
        return total;
    }

    public int sumOf(int face) {
        return count(face) * face;
    }

    public boolean isFiveOfAKind() {
        return faces[0] == faces[DICE - 1];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Roll)) return false;
        return Arrays.equals(faces, ((Roll) o).faces);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(faces);
    }

    @Override
    public String toString() {
        return Arrays.toString(faces);
    }
}
