package com.electionlens.boothrecon.service.mapping;

import com.electionlens.boothrecon.domain.CandidateRoster;
import com.electionlens.boothrecon.domain.ColumnMapping;
import com.electionlens.boothrecon.domain.ContestConfig;
import com.electionlens.boothrecon.domain.RawBoothRow;

import java.util.List;

/**
 * Strategy interface for inferring which extracted column belongs to which official candidate.
 *
 * <p><b>Available Strategies:</b>
 * <ul>
 *   <li>{@link com.electionlens.boothrecon.service.mapping.impl.PositionalMappingStrategy} -
 *       column {@code i} is candidate {@code i}</li>
 *   <li>{@link com.electionlens.boothrecon.service.mapping.impl.VoteTotalMappingStrategy} -
 *       greedy match of column totals to official totals, optionally scale-corrected</li>
 * </ul>
 *
 * <p>Strategies are tried in the order configured by {@code contest.mapping-strategies};
 * the first whose records pass validation is kept (see {@link ColumnMapper}).
 *
 * <p><b>Thread Safety:</b> Implementations must be stateless; one instance serves every contest.
 */
public interface ColumnMappingStrategy {

    /**
     * @return configuration name of the strategy (e.g., "positional")
     */
    String name();

    /**
     * Infers a mapping for one contest.
     *
     * @param rows   all extracted rows of the contest
     * @param roster official candidates
     * @param config contest constants
     * @return a mapping, possibly leaving columns or candidates unmapped
     */
    ColumnMapping infer(List<RawBoothRow> rows, CandidateRoster roster, ContestConfig config);
}
