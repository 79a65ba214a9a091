package com.tpgsweep.orchestrator.sweep;

import com.tpgsweep.orchestrator.model.DataType;
import com.tpgsweep.orchestrator.model.InstructionSet;
import com.tpgsweep.orchestrator.model.ParameterTuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the Cartesian product of a sweep's dimensions.
 *
 * Order is fixed: seed outermost, then instruction set, then data type.
 * Calling {@link #expand} again on the same definition returns the same list.
 *
 * <p>Mini sampling truncates every dimension on its own before the product,
 * so a reduced run still crosses each kept value with each other kept value.
 * The inference planner truncates its flattened product instead.
 */
@Component
public class ParameterSpaceExpander {

    private static final Logger log = LoggerFactory.getLogger(ParameterSpaceExpander.class);

    public List<ParameterTuple> expand(SweepDefinition definition) {
        int k = definition.mini();
        List<Integer>        seeds = truncate(definition.seeds(), k);
        List<InstructionSet> sets  = truncate(definition.instructionSets(), k);
        List<DataType>       types = truncate(definition.dataTypes(), k);

        List<ParameterTuple> tuples = new ArrayList<>(seeds.size() * sets.size() * types.size());
        for (int seed : seeds) {
            for (InstructionSet set : sets) {
                for (DataType type : types) {
                    tuples.add(new ParameterTuple(seed, set, type));
                }
            }
        }

        log.info("Expanded sweep into {} tuples ({} seeds x {} instruction sets x {} data types{})",
                tuples.size(), seeds.size(), sets.size(), types.size(),
                k > 0 ? ", mini=" + k : "");
        return List.copyOf(tuples);
    }

    /** First {@code k} values; {@code k <= 0} keeps them all. */
    public static <T> List<T> truncate(List<T> values, int k) {
        return k > 0 && values.size() > k ? values.subList(0, k) : values;
    }
}
