package com.electionlens.boothrecon.service.mapping;

import com.electionlens.boothrecon.domain.CandidateRoster;
import com.electionlens.boothrecon.domain.ColumnMapping;
import com.electionlens.boothrecon.domain.ContestConfig;
import com.electionlens.boothrecon.domain.MappingAttempt;
import com.electionlens.boothrecon.domain.RawBoothRow;
import com.electionlens.boothrecon.domain.ValidationReport;
import com.electionlens.boothrecon.exception.MappingFailedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tries mapping strategies in configured order until one produces records that pass
 * validation, within the contest's retry budget.
 */
@Service
public class ColumnMapper {

    private static final Logger LOG = LogManager.getLogger(ColumnMapper.class);

    // fewer hard failures first, then more mapped columns, then earlier attempt
    private static final Comparator<MappingAttempt> BEST_FIRST = Comparator
            .<MappingAttempt>comparingInt(a -> a.report().issues().size())
            .thenComparing(Comparator.<MappingAttempt>comparingInt(a -> a.mapping().mappedCount()).reversed());

    private final Map<String, ColumnMappingStrategy> strategies;

    public ColumnMapper(List<ColumnMappingStrategy> strategies) {
        Objects.requireNonNull(strategies, "strategies");
        Map<String, ColumnMappingStrategy> byName = new LinkedHashMap<>();
        for (ColumnMappingStrategy s : strategies) {
            if (byName.putIfAbsent(s.name(), s) != null) {
                throw new IllegalArgumentException("Duplicate mapping strategy name: " + s.name());
            }
        }
        this.strategies = Map.copyOf(byName);
    }

    /**
     * Resolves the configured strategy names.
     *
     * @throws IllegalArgumentException if a configured name has no strategy
     */
    public List<ColumnMappingStrategy> strategiesFor(ContestConfig config) {
        List<ColumnMappingStrategy> ordered = new ArrayList<>();
        for (String name : config.mappingStrategies()) {
            ColumnMappingStrategy s = strategies.get(name);
            if (s == null) {
                throw new IllegalArgumentException("Unknown mapping strategy '" + name
                        + "'. Available: " + strategies.keySet());
            }
            ordered.add(s);
        }
        return List.copyOf(ordered);
    }

    /**
     * Infers the column mapping of a contest.
     *
     * @param contestId  contest identifier for logs and errors
     * @param rows       extracted rows
     * @param roster     official candidates
     * @param config     contest constants (strategy order, retry budget)
     * @param validation verdict on each attempted mapping
     * @return the first accepted mapping
     * @throws MappingFailedException if no attempt within the budget passes validation
     */
    public MappingSelection infer(String contestId, List<RawBoothRow> rows, CandidateRoster roster,
                                  ContestConfig config, MappingValidation validation) {
        List<ColumnMappingStrategy> chain = strategiesFor(config);
        int budget = Math.min(config.retryBudget(), chain.size());
        List<MappingAttempt> attempts = new ArrayList<>(budget);

        for (int i = 0; i < budget; i++) {
            ColumnMappingStrategy strategy = chain.get(i);
            ColumnMapping mapping = strategy.infer(rows, roster, config);
            ValidationReport report = validation.validate(mapping);
            MappingAttempt attempt = new MappingAttempt(strategy.name(), mapping, report);
            attempts.add(attempt);

            if (report.passed()) {
                LOG.info("Mapping accepted: strategy={}, mapped={}/{} candidates, warnings={}",
                        strategy.name(), mapping.mappedCount(), roster.size(), report.warnings().size());
                return new MappingSelection(mapping, report, attempts);
            }
            LOG.info("Mapping rejected: strategy={}, issues={} (attempt {}/{})",
                    strategy.name(), report.issues().size(), i + 1, budget);
        }

        MappingAttempt best = attempts.stream().min(BEST_FIRST)
                .orElseThrow(() -> new IllegalStateException("No mapping attempts were made"));
        throw new MappingFailedException(contestId, best, attempts);
    }
}
