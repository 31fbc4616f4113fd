package com.softcheck.analysis;

import com.softcheck.exception.SemanticAnalysisException;
import com.softcheck.functions.FunctionEnvironment;
import com.softcheck.statement.Program;
import com.softcheck.statement.Statement;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Entry point of semantic analysis.
 *
 * <p>Each top-level statement is checked independently against a shared, immutable
 * function environment. Errors of the whole program are concatenated in statement
 * order, whatever the execution mode.
 *
 * <p>Example:
 * <pre>
 *   SemanticAnalyzer analyzer = SemanticAnalyzer.forProgram(program);
 *   AnalysisResult result = analyzer.analyze(program);
 *   result.report().forEach(System.err::println);
 * </pre>
 */
public final class SemanticAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private final FunctionEnvironment environment;
    private final StatementChecker statementChecker;
    private final AnalyzerConfig config;

    public SemanticAnalyzer(FunctionEnvironment environment, AnalyzerConfig config) {
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.statementChecker = new StatementChecker(environment);
    }

    /**
     * Creates an analyzer whose environment holds the built-ins and the program's
     * user functions.
     */
    public static SemanticAnalyzer forProgram(Program program) {
        return forProgram(program, AnalyzerConfig.defaults());
    }

    public static SemanticAnalyzer forProgram(Program program, AnalyzerConfig config) {
        return new SemanticAnalyzer(EnvironmentBuilder.build(program), config);
    }

    public FunctionEnvironment environment() {
        return environment;
    }

    public AnalyzerConfig config() {
        return config;
    }

    /**
     * Analyzes a program. Repeated calls on the same program return equal results.
     *
     * @param program the program
     * @return all errors, in program order
     * @throws SemanticAnalysisException if parallel analysis is interrupted or a worker fails
     */
    public AnalysisResult analyze(Program program) {
        Objects.requireNonNull(program, "program must not be null");
        long start = System.nanoTime();

        List<AnalysisError> errors = config.isParallel() && program.size() > 1
            ? analyzeParallel(program.statements())
            : analyzeSequential(program.statements());

        long elapsedMicros = (System.nanoTime() - start) / 1000;
        logger.info("Analyzed {} statements in {} us ({}): {} errors",
            program.size(), elapsedMicros, config.mode(), errors.size());
        return new AnalysisResult(errors);
    }

    private List<AnalysisError> analyzeSequential(List<Statement> statements) {
        List<AnalysisError> errors = new ArrayList<>();
        for (Statement statement : statements) {
            errors.addAll(checkStatement(statement));
        }
        return errors;
    }

    private List<AnalysisError> analyzeParallel(List<Statement> statements) {
        int threads = Math.min(config.threads(), statements.size());
        ExecutorService executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "softcheck-analysis");
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<List<AnalysisError>>> futures = new ArrayList<>(statements.size());
            for (Statement statement : statements) {
                futures.add(executor.submit(() -> checkStatement(statement)));
            }

            // joined in submission order so the result matches sequential mode
            List<AnalysisError> errors = new ArrayList<>();
            for (Future<List<AnalysisError>> future : futures) {
                errors.addAll(future.get());
            }
            return errors;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SemanticAnalysisException("Analysis interrupted", e);
        } catch (ExecutionException e) {
            throw new SemanticAnalysisException("Statement analysis failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private List<AnalysisError> checkStatement(Statement statement) {
        List<AnalysisError> errors = statementChecker.check(statement);
        if (!errors.isEmpty() && logger.isDebugEnabled()) {
            logger.debug("{} error(s) in {}", errors.size(), statement.getClass().getSimpleName());
        }
        return errors;
    }
}
