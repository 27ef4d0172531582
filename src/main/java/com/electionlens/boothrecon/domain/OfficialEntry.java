package com.electionlens.boothrecon.domain;

/**
 * One unranked row of the official-totals source, as handed in by the caller.
 *
 * @param name  candidate display name
 * @param party party code
 * @param votes official vote total
 */
public record OfficialEntry(String name, String party, int votes) {
}
