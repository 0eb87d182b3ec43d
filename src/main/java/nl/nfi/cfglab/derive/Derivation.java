package nl.nfi.cfglab.derive;

import nl.nfi.cfglab.grammar.Grammar;
import nl.nfi.cfglab.grammar.Production;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static nl.nfi.cfglab.grammar.Symbols.EPSILON;
import static nl.nfi.cfglab.grammar.Symbols.format;
import static nl.nfi.cfglab.grammar.Symbols.symbolsOf;

/**
 * An immutable derivation in a grammar: the start symbol followed by the sentential forms obtained by applying
 * a sequence of {@link Step}s. Every step method returns a new derivation and leaves this one untouched, also
 * when the step turns out to be invalid.
 * <p>
 * Two derivations are equal when they refer to the same grammar and consist of the same steps.
 */
public final class Derivation {

    private final Grammar grammar;
    private final List<Step> steps;
    private final List<String> sententialForm;
    private final String representation;

    private Derivation(final Grammar grammar, final List<Step> steps, final List<String> sententialForm, final String representation) {
        this.grammar = grammar;
        this.steps = steps;
        this.sententialForm = sententialForm;
        this.representation = representation;
    }

    public static Derivation of(final Grammar grammar) {
        return new Derivation(grammar, List.of(), List.of(grammar.start()), grammar.start());
    }

    public Grammar grammar() {
        return grammar;
    }

    public List<Step> steps() {
        return steps;
    }

    public List<String> sententialForm() {
        return sententialForm;
    }

    public Derivation step(final int production, final int position) {
        if (production < 0 || production >= grammar.productions().size()) {
            throw new InvalidStepException("There is no production %d, the grammar has %d productions".formatted(production, grammar.productions().size()));
        }
        if (position < 0 || position >= sententialForm.size()) {
            throw new InvalidStepException("There is no position %d in %s".formatted(position, formatForm(sententialForm)));
        }
        final Production applied = grammar.production(production);
        if (!matchesAt(applied, position)) {
            throw new InvalidStepException("Cannot apply %s at position %d of %s.".formatted(applied, position, formatForm(sententialForm)));
        }

        final List<String> next = new ArrayList<>(sententialForm.subList(0, position));
        next.addAll(symbolsOf(applied.rhs()));
        next.addAll(sententialForm.subList(position + applied.lhsSymbols().size(), sententialForm.size()));

        final List<Step> nextSteps = new ArrayList<>(steps);
        nextSteps.add(Step.of(production, position));

        final List<String> form = List.copyOf(next);
        return new Derivation(grammar, List.copyOf(nextSteps), form, representation + " -> " + formatForm(form));
    }

    public Derivation step(final Step step) {
        return step(step.production(), step.position());
    }

    public Derivation step(final List<Step> steps) {
        Derivation derivation = this;
        for (final Step step : steps) {
            derivation = derivation.step(step);
        }
        return derivation;
    }

    public Derivation leftmost(final int... productions) {
        Derivation derivation = this;
        for (final int production : productions) {
            derivation = derivation.outermost(production, true);
        }
        return derivation;
    }

    public Derivation leftmost(final List<Integer> productions) {
        return leftmost(productions.stream().mapToInt(Integer::intValue).toArray());
    }

    public Derivation leftmost(final Production... productions) {
        return leftmost(indicesOf(productions));
    }

    public Derivation rightmost(final int... productions) {
        Derivation derivation = this;
        for (final int production : productions) {
            derivation = derivation.outermost(production, false);
        }
        return derivation;
    }

    public Derivation rightmost(final List<Integer> productions) {
        return rightmost(productions.stream().mapToInt(Integer::intValue).toArray());
    }

    public Derivation rightmost(final Production... productions) {
        return rightmost(indicesOf(productions));
    }

    // every step applicable to the current sentential form, by production and then by position
    public List<Step> possibleSteps() {
        return possibleSteps(null, null);
    }

    // a null production or position means any
    public List<Step> possibleSteps(final Integer production, final Integer position) {
        final List<Step> possible = new ArrayList<>();
        for (int index = 0; index < grammar.productions().size(); index++) {
            if (production != null && production != index) {
                continue;
            }
            final Production candidate = grammar.production(index);
            for (int at = 0; at < sententialForm.size(); at++) {
                if (position != null && position != at) {
                    continue;
                }
                if (matchesAt(candidate, at)) {
                    possible.add(Step.of(index, at));
                }
            }
        }
        return possible;
    }

    private Derivation outermost(final int production, final boolean leftmost) {
        final String direction = leftmost ? "leftmost" : "rightmost";
        if (!grammar.isContextFree()) {
            throw new InvalidStepException("Cannot perform a %s derivation on a non context-free grammar".formatted(direction));
        }
        if (production < 0 || production >= grammar.productions().size()) {
            throw new InvalidStepException("There is no production %d, the grammar has %d productions".formatted(production, grammar.productions().size()));
        }

        final Production applied = grammar.production(production);
        final int size = sententialForm.size();
        for (int i = 0; i < size; i++) {
            final int position = leftmost ? i : size - 1 - i;
            final String symbol = sententialForm.get(position);
            if (grammar.isNonterminal(symbol)) {
                if (!applied.lhs().equals(symbol)) {
                    throw new InvalidStepException("Cannot apply %s: the %s nonterminal of %s is %s.".formatted(applied, direction, formatForm(sententialForm), symbol));
                }
                return step(production, position);
            }
        }
        throw new InvalidStepException("Cannot apply %s: there are no nonterminals in %s.".formatted(applied, formatForm(sententialForm)));
    }

    private boolean matchesAt(final Production production, final int position) {
        final List<String> lhs = production.lhsSymbols();
        return position + lhs.size() <= sententialForm.size()
            && sententialForm.subList(position, position + lhs.size()).equals(lhs);
    }

    private int[] indicesOf(final Production... productions) {
        final int[] indices = new int[productions.length];
        for (int i = 0; i < productions.length; i++) {
            indices[i] = grammar.indexOf(productions[i]);
            if (indices[i] < 0) {
                throw new InvalidStepException("Production %s is not part of the grammar".formatted(productions[i]));
            }
        }
        return indices;
    }

    // the sentential form that derived everything away is shown as ε
    private static String formatForm(final List<String> form) {
        return form.isEmpty() ? EPSILON : format(form);
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Derivation that)) {
            return false;
        }
        return grammar.equals(that.grammar) && steps.equals(that.steps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(grammar, steps);
    }

    // e.g. "E -> E + T -> T + T -> i + T"
    @Override
    public String toString() {
        return representation;
    }
}
