package net.grammarc.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.logging.Logger;
import net.grammarc.grammar.Alternative;
import net.grammarc.grammar.Rule;

/* Reports pairs of alternatives of the same rule whose First sets
 * intersect. Two nullable alternatives conflict on EPSILON. */
public class AmbiguityDetector implements Callable<AmbiguityReport> {

    private static final Logger LOGGER = Logger.getLogger("Ambiguity");

    private final FirstFollowSets sets;

    public AmbiguityDetector(FirstFollowSets sets) {
        if (sets == null)
            throw new NullPointerException(
                "First/Follow sets may not be null");
        this.sets = sets;
    }

    protected void checkRule(Rule rule, List<Ambiguity> drain) {
        List<Alternative> alts = rule.getAlternatives();
        if (alts.size() < 2) return;
        List<Set<String>> firsts = new ArrayList<Set<String>>();
        for (Alternative alt : alts) firsts.add(sets.firstOf(rule, alt));
        for (int i = 0; i < alts.size(); i++) {
            for (int j = i + 1; j < alts.size(); j++) {
                Set<String> overlap = new TreeSet<String>(firsts.get(i));
                overlap.retainAll(firsts.get(j));
                if (overlap.isEmpty()) continue;
                drain.add(new Ambiguity(rule.getName(), i, j, overlap));
            }
        }
    }

    public AmbiguityReport call() {
        List<Ambiguity> found = new ArrayList<Ambiguity>();
        for (Rule r : sets.getGraph().getRules()) checkRule(r, found);
        LOGGER.fine("Found " + found.size() + " ambiguous alternative " +
                    "pair(s)");
        return new AmbiguityReport(found);
    }

}
