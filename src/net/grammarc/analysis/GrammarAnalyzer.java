package net.grammarc.analysis;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.grammarc.api.GrammarView;
import net.grammarc.grammar.GrammarException;
import net.grammarc.lexgen.LexerAutomaton;
import net.grammarc.lexgen.LexerSynthesizer;
import net.grammarc.util.Logging;
import net.grammarc.util.config.Configuration;
import net.grammarc.util.config.DynamicConfiguration;

/**
 * Runs all analysis passes over a grammar.
 * The rule graph is built (and the grammar validated) first; the remaining
 * passes only read it and may run concurrently if the configuration asks
 * for it. The result is the same either way.
 */
public class GrammarAnalyzer {

    public static final String PARALLEL_KEY = "grammarc.analysis.parallel";
    public static final String ENTRY_RULE_KEY =
        "grammarc.analysis.entryRule";
    public static final String MAX_STATES_KEY = "grammarc.lexer.maxStates";

    private static final Logger LOGGER = Logger.getLogger("Analyzer");

    private final DynamicConfiguration config;

    public GrammarAnalyzer(Configuration config) {
        if (config == null)
            throw new NullPointerException(
                "Configuration may not be null");
        this.config = DynamicConfiguration.wrap(config);
    }
    public GrammarAnalyzer() {
        this(DynamicConfiguration.makeDefault());
    }

    public DynamicConfiguration getConfig() {
        return config;
    }

    /**
     * Installs the log format and the root log level for a process that
     * drives the analyzer.
     */
    public Level initLogging() {
        Logging.initFormat();
        return Logging.applyLevel(config);
    }

    public boolean isParallel() {
        return config.getBoolean(PARALLEL_KEY, false);
    }

    public String getEntryRuleOverride() {
        String ret = config.get(ENTRY_RULE_KEY);
        return (ret == null || ret.trim().isEmpty()) ? null : ret.trim();
    }

    public int getMaxStates() {
        return config.getInt(MAX_STATES_KEY, 0);
    }

    public RuleGraph buildGraph(GrammarView grammar)
            throws GrammarException {
        return new RuleGraphBuilder(grammar, getEntryRuleOverride()).call();
    }

    public AnalysisResult analyze(GrammarView grammar)
            throws GrammarException {
        RuleGraph graph = buildGraph(grammar);
        AnalysisResult ret = (isParallel()) ? runParallel(graph) :
            runSequential(graph);
        LOGGER.fine("Analyzed grammar " + grammar.getName() + ": " +
                    ret.getDiagnostics().size() + " warning(s)");
        return ret;
    }

    protected AnalysisResult runSequential(RuleGraph graph)
            throws GrammarException {
        FirstFollowSets sets = new FirstFollowComputer(graph).call();
        LeftRecursionReport lr = new LeftRecursionDetector(sets).call();
        AmbiguityReport amb = new AmbiguityDetector(sets).call();
        ReachabilityReport reach = new ReachabilityAnalyzer(graph).call();
        LexerAutomaton lexer = new LexerSynthesizer(graph,
                                                    getMaxStates()).call();
        return new AnalysisResult(graph, sets, lr, amb, reach, lexer);
    }

    protected AnalysisResult runParallel(RuleGraph graph)
            throws GrammarException {
        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            Future<FirstFollowSets> sets = pool.submit(
                new FirstFollowComputer(graph));
            Future<ReachabilityReport> reach = pool.submit(
                new ReachabilityAnalyzer(graph));
            Future<LexerAutomaton> lexer = pool.submit(
                new LexerSynthesizer(graph, getMaxStates()));
            FirstFollowSets ff = await(sets);
            Future<LeftRecursionReport> lr = pool.submit(
                new LeftRecursionDetector(ff));
            Future<AmbiguityReport> amb = pool.submit(
                new AmbiguityDetector(ff));
            return new AnalysisResult(graph, ff, await(lr), await(amb),
                                      await(reach), await(lexer));
        } finally {
            pool.shutdownNow();
        }
    }

    private static <T> T await(Future<T> future) throws GrammarException {
        try {
            return future.get();
        } catch (InterruptedException exc) {
            Thread.currentThread().interrupt();
            throw new GrammarException("Interrupted while analyzing", exc);
        } catch (ExecutionException exc) {
            Throwable cause = exc.getCause();
            if (cause instanceof GrammarException)
                throw (GrammarException) cause;
            if (cause instanceof RuntimeException)
                throw (RuntimeException) cause;
            if (cause instanceof Error)
                throw (Error) cause;
            throw new GrammarException(cause);
        }
    }

}
