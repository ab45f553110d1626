package me.christianrobert.pystyle.transformer.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.pystyle.config.model.ConversionConfig;
import me.christianrobert.pystyle.config.service.ConfigService;
import me.christianrobert.pystyle.transformer.ast.ModuleNode;
import me.christianrobert.pystyle.transformer.cache.CacheEntry;
import me.christianrobert.pystyle.transformer.cache.CacheStatistics;
import me.christianrobert.pystyle.transformer.cache.ConversionCache;
import me.christianrobert.pystyle.transformer.cache.FingerprintCalculator;
import me.christianrobert.pystyle.transformer.context.TransformationException;
import me.christianrobert.pystyle.transformer.context.TransformationResult;
import me.christianrobert.pystyle.transformer.mapping.BuiltinMappings;
import me.christianrobert.pystyle.transformer.parser.SourceParser;
import me.christianrobert.pystyle.transformer.plugin.PluginChain;
import me.christianrobert.pystyle.transformer.plugin.PluginRegistry;
import me.christianrobert.pystyle.transformer.util.AstTreeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main service for converting scripts into the braces-delimited target dialect.
 *
 * <p>This service provides the public API for conversion and manages the underlying
 * infrastructure (parser seam, configuration, plugin registry, result cache).</p>
 *
 * <p>Architecture:</p>
 * <pre>
 * Source text (+ optional pre-parsed ModuleNode)
 *   → fingerprint (source bytes + configuration + plugin id:version list)
 *   → ConversionCache hit?  → cached TransformationResult
 *   → SourceParser           (only on a miss, only without a pre-parsed tree)
 *   → ConversionPipeline     (validate, hooks, inference, render)
 *   → ConversionCache put    (first writer wins)
 *   → TransformationResult   (text + diagnostics, or a single fatal error)
 * </pre>
 *
 * <p>Each call is timed in {@link ConversionMetrics}. With {@link ConfigService#CACHE_FILE} set,
 * a new cache starts from the saved entries and {@link #saveCache()} writes them back.</p>
 *
 * <p>Failures never produce partial output: a malformed tree or an unexpected error
 * yields {@link TransformationResult#failure} and nothing is cached.</p>
 */
@ApplicationScoped
public class TransformationService {

    private static final Logger log = LoggerFactory.getLogger(TransformationService.class);

    @Inject
    SourceParser parser;

    @Inject
    ConfigService configService;

    @Inject
    PluginRegistry pluginRegistry;

    private final ConversionMetrics metrics = new ConversionMetrics();

    private ConversionCache cache;

    /**
     * Converts source text using the injected parser.
     *
     * @param source Source text of a complete module
     * @return TransformationResult containing the rendered text or error details
     */
    public TransformationResult transform(String source) {
        return transform(source, null, false);
    }

    /**
     * Converts source text and optionally includes the annotated syntax tree.
     * Asking for the tree bypasses the cache.
     */
    public TransformationResult transform(String source, boolean includeAst) {
        return transform(source, null, includeAst);
    }

    /**
     * Converts a tree that was parsed elsewhere. The source text is still required
     * because the cache fingerprint is computed from it.
     */
    public TransformationResult transform(String source, ModuleNode module) {
        return transform(source, module, false);
    }

    /**
     * Converts a module, parsing {@code source} only when no tree is given and the
     * result is not already cached.
     *
     * @param source Source text (fingerprint input, parser input)
     * @param module Pre-parsed tree, or null to use the injected parser
     * @param includeAst Whether to include the annotated tree in the result (for debugging)
     * @return TransformationResult containing the rendered text or error details
     */
    public TransformationResult transform(String source, ModuleNode module, boolean includeAst) {
        long start = System.nanoTime();
        TransformationResult result = doTransform(source, module, includeAst);
        metrics.record(System.nanoTime() - start, result.isSuccess());
        return result;
    }

    private TransformationResult doTransform(String source, ModuleNode module, boolean includeAst) {
        if (source == null) {
            return TransformationResult.failure(null, "Source text cannot be null");
        }
        if (module == null && parser == null) {
            return TransformationResult.failure(source, "No source parser available and no syntax tree given");
        }

        ConversionConfig config;
        try {
            config = configService.getConversionConfig();
        } catch (IllegalArgumentException e) {
            log.error("Invalid conversion configuration: {}", e.getMessage());
            return TransformationResult.failure(source, "Invalid configuration: " + e.getMessage());
        }
        PluginChain chain = pluginRegistry != null ? pluginRegistry.getChain() : PluginChain.EMPTY;

        log.debug("Transforming module ({} chars)", source.length());
        log.trace("Source text: {}", source);

        try {
            if (includeAst) {
                ConversionOutput output = convert(source, module, config, chain);
                String astTree = AstTreeFormatter.format(output.getModule(), output.getEnvironment());
                log.info("Successfully transformed module (AST requested, cache bypassed)");
                return TransformationResult.successWithAst(source, output.getRenderedText(),
                        output.getDiagnostics(), astTree);
            }

            ConversionCache activeCache = cacheFor(config);
            if (!activeCache.isEnabled()) {
                ConversionOutput output = convert(source, module, config, chain);
                log.info("Successfully transformed module (caching disabled)");
                return TransformationResult.success(source, output.getRenderedText(), output.getDiagnostics());
            }

            String environmentFingerprint =
                    FingerprintCalculator.environmentFingerprint(config, chain.getFingerprintTokens());
            activeCache.ensureEnvironment(environmentFingerprint);
            String fingerprint = FingerprintCalculator.fingerprint(source, environmentFingerprint);

            AtomicBoolean computed = new AtomicBoolean(false);
            CacheEntry entry = activeCache.getOrCompute(fingerprint, () -> {
                computed.set(true);
                ConversionOutput output = convert(source, module, config, chain);
                return new CacheEntry(fingerprint, output.getRenderedText(), output.getDiagnostics());
            });

            if (!computed.get()) {
                log.debug("Cache hit for fingerprint {}", fingerprint);
                return TransformationResult.cached(source, entry.getRenderedText(), entry.getDiagnostics());
            }
            log.info("Successfully transformed module");
            return TransformationResult.success(source, entry.getRenderedText(), entry.getDiagnostics());

        } catch (TransformationException e) {
            log.error("Transformation failed: {}", e.getDetailedMessage(), e);
            return TransformationResult.failure(source, e);
        } catch (Exception e) {
            log.error("Unexpected error during transformation", e);
            return TransformationResult.failure(source, "Unexpected error: " + e.getMessage());
        }
    }

    /**
     * Hit, miss and eviction counters of the current cache.
     */
    public CacheStatistics getCacheStatistics() {
        return cacheFor(configService.getConversionConfig()).getStatistics();
    }

    /**
     * Timing of every {@code transform} call since startup.
     */
    public ConversionMetrics getConversionMetrics() {
        return metrics;
    }

    public synchronized void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    /**
     * Writes the current cache to the file named by {@link ConfigService#CACHE_FILE}.
     *
     * @return the number of entries written, 0 when no cache file is configured
     * @throws IOException if the file cannot be written
     */
    public synchronized int saveCache() throws IOException {
        Path file = configuredCacheFile();
        if (file == null) {
            log.debug("No cache file configured, nothing saved");
            return 0;
        }
        return cacheFor(configService.getConversionConfig()).save(file);
    }

    private ConversionOutput convert(String source, ModuleNode module, ConversionConfig config, PluginChain chain) {
        ModuleNode tree = module;
        if (tree == null) {
            // STEP 1: Parse (only when no tree was handed over)
            log.debug("Step 1: Parsing source text");
            tree = parser.parse(source);
        }

        // STEP 2: Run the pipeline
        log.debug("Step 2: Running conversion pipeline");
        ConversionPipeline pipeline = new ConversionPipeline(BuiltinMappings.defaultTable(), chain, config);
        return pipeline.run(tree);
    }

    /**
     * Returns the cache sized for the configured capacity, replacing it when the capacity changed.
     */
    private synchronized ConversionCache cacheFor(ConversionConfig config) {
        if (cache == null || cache.getCapacity() != config.getCacheCapacity()) {
            log.debug("Creating conversion cache with capacity {}", config.getCacheCapacity());
            cache = new ConversionCache(config.getCacheCapacity());
            loadCacheFile(cache);
        }
        return cache;
    }

    /**
     * Fills a new cache from the configured cache file. An unreadable file is reported and
     * the cache starts empty.
     */
    private void loadCacheFile(ConversionCache target) {
        Path file = configuredCacheFile();
        if (file == null) {
            return;
        }
        try {
            target.load(file);
        } catch (IOException e) {
            log.warn("Could not load cache file {}, starting with an empty cache: {}", file, e.getMessage());
            target.clear();
        }
    }

    private Path configuredCacheFile() {
        String file = configService.getConfigValueAsString(ConfigService.CACHE_FILE);
        if (file == null || file.trim().isEmpty()) {
            return null;
        }
        return Paths.get(file.trim());
    }
}
