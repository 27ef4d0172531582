package com.electionlens.boothrecon.domain;

import java.util.List;
import java.util.Objects;

/**
 * Per-polling-station vote record in official candidate order.
 *
 * <p>{@code votes.get(i)} belongs to {@code roster.get(i)}, regardless of the column the
 * value was printed in. {@code total == sum(votes)} always holds.
 *
 * @param boothId polling-station identifier
 * @param votes   one entry per official candidate
 * @param total   sum of {@code votes}
 */
public record BoothRecord(BoothId boothId, List<Integer> votes, int total) {

    public BoothRecord {
        Objects.requireNonNull(boothId, "boothId");
        votes = List.copyOf(Objects.requireNonNull(votes, "votes"));
        int sum = sum(votes);
        if (total != sum) {
            throw new IllegalArgumentException("Booth " + boothId + " total " + total
                    + " does not equal sum of votes " + sum);
        }
    }

    public static BoothRecord of(BoothId boothId, List<Integer> votes) {
        return new BoothRecord(boothId, votes, sum(votes));
    }

    public static BoothRecord of(BoothId boothId, int[] votes) {
        Integer[] boxed = new Integer[votes.length];
        for (int i = 0; i < votes.length; i++) {
            boxed[i] = votes[i];
        }
        return of(boothId, List.of(boxed));
    }

    public int vote(int candidateIndex) {
        return votes.get(candidateIndex);
    }

    public int[] votesArray() {
        int[] result = new int[votes.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = votes.get(i);
        }
        return result;
    }

    private static int sum(List<Integer> values) {
        int s = 0;
        for (Integer v : values) {
            s += Objects.requireNonNull(v, "vote value");
        }
        return s;
    }
}
