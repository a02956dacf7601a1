package com.grigorchuk.core.algebra;

import com.grigorchuk.core.Generator;
import java.util.List;

/**
 * Label recording the last right multiplication that produced an element. The composite steps
 * {@link #AC} and {@link #CA} are the two length-two edges of the Cayley graph.
 */
public enum PathStep {
    A(List.of(Generator.A)),
    B(List.of(Generator.B)),
    C(List.of(Generator.C)),
    D(List.of(Generator.D)),
    AC(List.of(Generator.A, Generator.C)),
    CA(List.of(Generator.C, Generator.A));

    private final List<Generator> generators;
    private final String word;

    PathStep(List<Generator> generators) {
        this.generators = generators;
        StringBuilder builder = new StringBuilder(generators.size());
        for (Generator generator : generators) {
            builder.append(generator.symbol());
        }
        this.word = builder.toString();
    }

    /**
     * Generators applied by this step, in application order.
     */
    public List<Generator> generators() {
        return generators;
    }

    public String word() {
        return word;
    }
}
