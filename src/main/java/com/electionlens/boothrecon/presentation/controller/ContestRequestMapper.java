package com.electionlens.boothrecon.presentation.controller;

import com.electionlens.boothrecon.config.properties.ContestProperties;
import com.electionlens.boothrecon.domain.BoothId;
import com.electionlens.boothrecon.domain.Candidate;
import com.electionlens.boothrecon.domain.CandidateRoster;
import com.electionlens.boothrecon.domain.ContestConfig;
import com.electionlens.boothrecon.domain.ContestInput;
import com.electionlens.boothrecon.domain.OfficialEntry;
import com.electionlens.boothrecon.exception.InvalidContestDataException;
import com.electionlens.boothrecon.presentation.dto.CandidateEntry;
import com.electionlens.boothrecon.presentation.dto.ReconcileContestRequest;
import com.electionlens.boothrecon.service.mapping.ColumnMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link ContestInput} from a request, applying configured defaults and per-request
 * overrides. Malformed requests are reported as {@link InvalidContestDataException}.
 */
@Component
class ContestRequestMapper {

    private final ContestProperties properties;
    private final ColumnMapper columnMapper;

    ContestRequestMapper(ContestProperties properties, ColumnMapper columnMapper) {
        this.properties = properties;
        this.columnMapper = columnMapper;
    }

    ContestInput toInput(ReconcileContestRequest request) {
        List<OfficialEntry> entries = request.candidates().stream()
                .map(c -> new OfficialEntry(c.name(), c.party(), c.votes()))
                .toList();
        CandidateRoster roster = CandidateRoster.rank(entries, properties.getNoneOfTheAboveParty());
        return new ContestInput(
                request.contestId(),
                request.lines(),
                roster,
                boothIds(request.knownBoothIds()),
                declaredOutOfBooth(request.candidates(), roster),
                config(request));
    }

    private ContestConfig config(ReconcileContestRequest request) {
        try {
            ContestConfig config = properties.toContestConfig()
                    .withOverrides(request.maxVotesPerBooth(), request.mappingCeiling(), request.retryBudget());
            if (request.mappingStrategies() != null && !request.mappingStrategies().isEmpty()) {
                config = config.withMappingStrategies(request.mappingStrategies());
            }
            columnMapper.strategiesFor(config);
            return config;
        } catch (IllegalArgumentException e) {
            throw new InvalidContestDataException(e.getMessage());
        }
    }

    private static Set<BoothId> boothIds(List<String> raw) {
        if (raw == null) {
            return Set.of();
        }
        Set<BoothId> ids = new HashSet<>();
        for (String s : raw) {
            try {
                ids.add(BoothId.parse(s));
            } catch (IllegalArgumentException e) {
                throw new InvalidContestDataException(e.getMessage());
            }
        }
        return ids;
    }

    /**
     * Postal figures in roster order; empty when no candidate declared any.
     */
    private static List<Integer> declaredOutOfBooth(List<CandidateEntry> candidates, CandidateRoster roster) {
        boolean anyDeclared = candidates.stream().anyMatch(c -> c.postalVotes() != null);
        if (!anyDeclared) {
            return List.of();
        }
        Map<String, Integer> byKey = new HashMap<>();
        for (CandidateEntry c : candidates) {
            byKey.put(key(c.name(), c.party()), c.postalVotes() == null ? 0 : c.postalVotes());
        }
        List<Integer> declared = new ArrayList<>(roster.size());
        for (Candidate c : roster.candidates()) {
            declared.add(byKey.getOrDefault(key(c.name(), c.party()), 0));
        }
        return declared;
    }

    private static String key(String name, String party) {
        return name + '\u0000' + party;
    }
}
