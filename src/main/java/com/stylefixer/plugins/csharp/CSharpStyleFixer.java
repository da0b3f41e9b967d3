package com.stylefixer.plugins.csharp;

import com.stylefixer.api.AppliedFix;
import com.stylefixer.api.Diagnostic;
import com.stylefixer.api.FixResult;
import com.stylefixer.api.FixerPlugin;
import com.stylefixer.api.error.FixerError;
import com.stylefixer.api.error.Severity;
import com.stylefixer.config.FixerConfig;
import com.stylefixer.plugins.csharp.analyzers.CombinedDeclarationAnalyzer;
import com.stylefixer.plugins.csharp.analyzers.MultipleStatementsAnalyzer;
import com.stylefixer.plugins.csharp.fixes.DeclarationSplitter;
import com.stylefixer.plugins.csharp.fixes.StatementSeparatorFixer;
import com.stylefixer.plugins.csharp.parser.CSharpParser;
import com.stylefixer.plugins.csharp.parser.SyntaxException;
import com.stylefixer.rewrite.BatchFixCoordinator;
import com.stylefixer.rewrite.BatchFixResult;
import com.stylefixer.rewrite.CancellationToken;
import com.stylefixer.rewrite.ConflictingEditException;
import com.stylefixer.rewrite.IndentationSettings;
import com.stylefixer.syntax.SourceText;
import com.stylefixer.syntax.SourceTree;
import com.stylefixer.syntax.TextSpan;
import com.stylefixer.util.LoggerUtil;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

/**
 * C# style fixer plugin with a parse cache.
 * Each enabled rule is analyzed on the current tree and all of its violations are
 * fixed in one batch before the next rule runs.
 */
public class CSharpStyleFixer implements FixerPlugin, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(CSharpStyleFixer.class);

    static final String CONFLICT_MESSAGE = "fix-all could not be applied to this file";

    private static final int CACHE_SIZE = 100;

    private final ExecutorService fixExecutor;
    private FixerConfig config;
    private IndentationSettings settings;
    private List<RuleDefinition> rules;

    // Insertion order, so lookups under the read lock never restructure the map
    private final Map<String, SourceTree> treeCache = new LinkedHashMap<String, SourceTree>(CACHE_SIZE, 0.75f, false) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, SourceTree> eldest) {
            return size() > CACHE_SIZE;
        }
    };

    private final ReentrantReadWriteLock cacheLock = new ReentrantReadWriteLock();
    private final ReentrantReadWriteLock.ReadLock readLock = cacheLock.readLock();
    private final ReentrantReadWriteLock.WriteLock writeLock = cacheLock.writeLock();

    public CSharpStyleFixer() {
        this(null);
    }

    /**
     * @param fixExecutor pool on which the single fixes of one batch are computed, or {@code null}
     *                    to compute them on the calling thread
     */
    public CSharpStyleFixer(ExecutorService fixExecutor) {
        this.fixExecutor = fixExecutor;
    }

    @Override
    public void initialize(FixerConfig config) {
        this.config = config;
        this.settings = config.getIndentationSettings();

        List<RuleDefinition> all = new ArrayList<>();
        all.add(new RuleDefinition(MultipleStatementsAnalyzer.RULE_ID,
                "Code should not contain multiple statements on one line",
                new MultipleStatementsAnalyzer(), new StatementSeparatorFixer()));
        boolean includeLocals = config.getRuleConfig(CombinedDeclarationAnalyzer.RULE_ID, "includeLocals", false);
        all.add(new RuleDefinition(CombinedDeclarationAnalyzer.RULE_ID,
                "Each variable should be declared on its own line",
                new CombinedDeclarationAnalyzer(includeLocals), new DeclarationSplitter()));

        rules = new ArrayList<>();
        for (RuleDefinition rule : all) {
            if (config.isRuleEnabled(rule.getRuleId())) {
                rules.add(rule);
            } else {
                logger.config("Rule " + rule.getRuleId() + " is disabled");
            }
        }
        logger.fine("Initialized C# plugin with rules " + getRuleIds() + " and " + settings);
    }

    public List<String> getRuleIds() {
        List<String> ids = new ArrayList<>();
        for (RuleDefinition rule : rules) {
            ids.add(rule.getRuleId());
        }
        return Collections.unmodifiableList(ids);
    }

    @Override
    public FixResult fix(Path filePath, String sourceCode) {
        _checkInitialized();
        SourceTree tree;
        try {
            tree = _parse(filePath, sourceCode);
        } catch (SyntaxException e) {
            return _handleParseError(filePath, sourceCode, e);
        }

        List<FixerError> errors = new ArrayList<>();
        List<AppliedFix> appliedFixes = new ArrayList<>();

        for (RuleDefinition rule : rules) {
            List<Diagnostic> diagnostics = rule.getAnalyzer().analyze(tree);
            if (diagnostics.isEmpty()) {
                continue;
            }

            BatchFixCoordinator coordinator = new BatchFixCoordinator(tree, rule.getFix(), settings, fixExecutor);
            BatchFixResult batch;
            try {
                batch = coordinator.computeBatchFix(diagnostics, CancellationToken.NONE);
            } catch (ConflictingEditException e) {
                logger.warning("Conflicting " + rule.getRuleId() + " fixes in " + filePath + ": " + e.getMessage());
                return _handleConflict(sourceCode, tree, rule, diagnostics, e);
            }

            SourceText text = tree.getText();
            for (Diagnostic diagnostic : batch.getFixed()) {
                TextSpan span = diagnostic.getSpan();
                appliedFixes.add(new AppliedFix(rule.getRuleId(),
                        text.getLineNumber(span.getStart()) + 1,
                        text.getLineNumber(span.getEnd()) + 1,
                        rule.getTitle()));
                errors.add(_toError(text, diagnostic, Severity.INFO, null));
            }
            for (Diagnostic diagnostic : batch.getNotApplicable()) {
                errors.add(_toError(text, diagnostic, Severity.WARNING, "No automatic fix is available"));
            }

            tree = batch.apply();
            logger.fine("Applied " + batch.getFixed().size() + " " + rule.getRuleId() + " fixes to " + filePath);
        }

        return FixResult.builder()
                .successful(errors.stream().noneMatch(e -> e.getSeverity().isFailure()))
                .originalCode(sourceCode)
                .fixedCode(tree.toFullString())
                .errors(errors)
                .appliedFixes(appliedFixes)
                .build();
    }

    @Override
    public FixResult analyze(Path filePath, String sourceCode) {
        _checkInitialized();
        SourceTree tree;
        try {
            tree = _parse(filePath, sourceCode);
        } catch (SyntaxException e) {
            return _handleParseError(filePath, sourceCode, e);
        }

        List<FixerError> errors = new ArrayList<>();
        for (RuleDefinition rule : rules) {
            for (Diagnostic diagnostic : rule.getAnalyzer().analyze(tree)) {
                errors.add(_toError(tree.getText(), diagnostic, Severity.WARNING, "Run the fix command to correct this"));
            }
        }

        return FixResult.builder()
                .successful(true)
                .originalCode(sourceCode)
                .fixedCode(sourceCode)
                .errors(errors)
                .build();
    }

    private SourceTree _parse(Path filePath, String sourceCode) {
        String cacheKey = filePath + ":" + sourceCode.hashCode();

        readLock.lock();
        try {
            SourceTree cached = treeCache.get(cacheKey);
            if (cached != null && cached.toFullString().equals(sourceCode)) {
                return cached;
            }
        } finally {
            readLock.unlock();
        }

        SourceTree tree = CSharpParser.parse(sourceCode);

        writeLock.lock();
        try {
            treeCache.put(cacheKey, tree);
        } finally {
            writeLock.unlock();
        }
        return tree;
    }

    private FixResult _handleParseError(Path filePath, String sourceCode, SyntaxException e) {
        logger.warning("Failed to parse " + filePath + ": " + e.getMessage());
        FixerError error = new FixerError(
                Severity.FATAL,
                "Failed to parse C# source code: " + e.getMessage(),
                e.getLine(), e.getColumn());

        return FixResult.builder()
                .successful(false)
                .originalCode(sourceCode)
                .fixedCode(null)
                .addError(error)
                .build();
    }

    private FixResult _handleConflict(String sourceCode, SourceTree tree, RuleDefinition rule,
                                      List<Diagnostic> diagnostics, ConflictingEditException e) {
        SourceText text = tree.getText();
        TextSpan span = e.getSecond().getSpan();
        List<FixerError> errors = new ArrayList<>();
        errors.add(new FixerError(Severity.ERROR, rule.getRuleId(), CONFLICT_MESSAGE,
                text.getLineNumber(span.getStart()) + 1, text.getColumn(span.getStart()) + 1,
                "Fix the reported lines by hand or fix one violation at a time"));
        for (Diagnostic diagnostic : diagnostics) {
            errors.add(_toError(text, diagnostic, Severity.WARNING, null));
        }

        return FixResult.builder()
                .successful(false)
                .originalCode(sourceCode)
                .fixedCode(sourceCode)
                .errors(errors)
                .build();
    }

    private static FixerError _toError(SourceText text, Diagnostic diagnostic, Severity severity, String suggestion) {
        int start = diagnostic.getSpan().getStart();
        return new FixerError(severity, diagnostic.getRuleId(), diagnostic.getMessage(),
                text.getLineNumber(start) + 1, text.getColumn(start) + 1, suggestion);
    }

    private void _checkInitialized() {
        if (config == null) {
            throw new IllegalStateException("Plugin has not been initialized");
        }
    }

    /**
     * Cleans up resources when the fixer is no longer needed.
     */
    @Override
    public void close() {
        writeLock.lock();
        try {
            treeCache.clear();
        } finally {
            writeLock.unlock();
        }
    }
}
