package me.christianrobert.cljtojs.transformer.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.cljtojs.config.service.ConfigService;
import me.christianrobert.cljtojs.target.TargetNode;
import me.christianrobert.cljtojs.transformer.builder.TargetCodeBuilder;
import me.christianrobert.cljtojs.transformer.context.TranslationContext;
import me.christianrobert.cljtojs.transformer.context.TranslationException;
import me.christianrobert.cljtojs.transformer.context.TranslationResult;
import me.christianrobert.cljtojs.transformer.context.TranslatorSettings;
import me.christianrobert.cljtojs.transformer.naming.SequentialNameGenerator;
import me.christianrobert.cljtojs.transformer.tree.SourceNode;
import me.christianrobert.cljtojs.transformer.tree.SourceTrees;
import me.christianrobert.cljtojs.transformer.util.SourceTreeFormatter;
import me.christianrobert.cljtojs.transformer.util.TargetTreeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Translation service for Lisp source trees.
 *
 * <p>Architecture:
 * <pre>
 * Reader (external) → SourceNode → TargetCodeBuilder → List&lt;TargetNode&gt; → Emitter (external)
 *                                        ↓
 *                               Static Visit* helpers
 * </pre>
 *
 * <p>Each call to {@link #translateUnit} is one compilation unit: a fresh
 * {@link TranslationContext} with its own name generator and vector identity counter,
 * forms translated strictly in source order. Synthetic names are therefore deterministic
 * for a given input.</p>
 *
 * <p>Translation is all or nothing. Any {@link TranslationException} aborts the unit and
 * is returned as a failure result; no partial output is returned.</p>
 */
@ApplicationScoped
public class TranslationService {

    private static final Logger log = LoggerFactory.getLogger(TranslationService.class);

    @Inject
    ConfigService configService;

    /**
     * Translates a single tree (one form, or a sequence of forms) as its own compilation unit.
     *
     * @param tree Source tree as produced by the reader
     * @return TranslationResult containing either the translated nodes or error details
     */
    public TranslationResult translate(SourceNode tree) {
        if (tree == null) {
            return TranslationResult.failure("Source tree cannot be null");
        }
        List<SourceNode> forms = new ArrayList<>();
        forms.add(tree);
        return translateUnit(forms, includeTreesByDefault());
    }

    /**
     * Translates the top-level forms of a compilation unit.
     *
     * @param forms Top-level forms in source order
     * @param includeTrees Whether to attach rendered source and target trees (for debugging)
     * @return TranslationResult with the concatenated output of all forms, or error details
     */
    public TranslationResult translateUnit(List<SourceNode> forms, boolean includeTrees) {
        if (forms == null) {
            return TranslationResult.failure("Forms cannot be null");
        }
        TranslatorSettings settings;
        try {
            settings = currentSettings();
        } catch (IllegalArgumentException e) {
            log.warn("Invalid translator configuration: {}", e.getMessage());
            return TranslationResult.failure("Invalid translator configuration: " + e.getMessage());
        }
        TranslationContext context = new TranslationContext(new SequentialNameGenerator(), settings);
        return translateUnit(forms, context, includeTrees);
    }

    /**
     * Translates the top-level forms of a compilation unit against a caller-supplied context.
     *
     * <p>The context must not be shared with another unit that is translated concurrently.</p>
     *
     * @param forms Top-level forms in source order
     * @param context Compilation unit state (names, settings, identity counter)
     * @param includeTrees Whether to attach rendered source and target trees
     * @return TranslationResult with the concatenated output, or error details
     */
    public TranslationResult translateUnit(List<SourceNode> forms, TranslationContext context, boolean includeTrees) {
        if (forms == null) {
            return TranslationResult.failure("Forms cannot be null");
        }
        if (context == null) {
            return TranslationResult.failure("Translation context cannot be null");
        }

        log.debug("Translating compilation unit with {} top-level forms", forms.size());

        String sourceTree = null;
        if (includeTrees) {
            sourceTree = SourceTreeFormatter.format(SourceTrees.chain(forms));
            log.trace("Source tree:\n{}", sourceTree);
        }

        try {
            TargetCodeBuilder builder = new TargetCodeBuilder(context);
            List<TargetNode> output = new ArrayList<>();
            for (SourceNode form : forms) {
                output.addAll(builder.visit(form));
            }

            log.debug("Translated {} forms into {} target nodes ({} vector literals)",
                    forms.size(), output.size(), context.getVectorIdentity());

            if (includeTrees) {
                String targetTree = TargetTreeFormatter.format(output);
                log.trace("Target tree:\n{}", targetTree);
                return TranslationResult.successWithTrees(output, sourceTree, targetTree);
            }
            return TranslationResult.success(output);

        } catch (TranslationException e) {
            log.warn("Translation failed: {}", e.getDetailedMessage());
            log.debug("Translation failure stack trace", e);
            if (includeTrees) {
                return TranslationResult.failureWithTree(e, sourceTree);
            }
            return TranslationResult.failure(e);
        }
    }

    private TranslatorSettings currentSettings() {
        if (configService == null) {
            return TranslatorSettings.defaults();
        }
        return TranslatorSettings.fromConfig(configService);
    }

    private boolean includeTreesByDefault() {
        if (configService == null) {
            return false;
        }
        Boolean include = configService.getConfigValueAsBoolean(ConfigService.INCLUDE_TREES);
        return include != null && include;
    }
}
