package me.christianrobert.pystyle.transformer.service;

import me.christianrobert.pystyle.config.service.ConfigService;
import me.christianrobert.pystyle.transformer.ast.ModuleNode;
import me.christianrobert.pystyle.transformer.ast.SourceSpan;
import me.christianrobert.pystyle.transformer.context.DiagnosticCode;
import me.christianrobert.pystyle.transformer.context.MalformedInputException;
import me.christianrobert.pystyle.transformer.context.TransformationResult;
import me.christianrobert.pystyle.transformer.parser.SourceParser;
import me.christianrobert.pystyle.transformer.plugin.PluginRegistry;
import me.christianrobert.pystyle.transformer.plugin.TestPlugin;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static me.christianrobert.pystyle.transformer.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Tests for the service entry point: parsing, caching and error reporting.
 * The parser is mocked; trees are built by hand.
 */
class TransformationServiceTest {

    private static final String SOURCE = "x = 1";

    private TransformationService service;
    private SourceParser parser;
    private ConfigService configService;
    private PluginRegistry pluginRegistry;

    @BeforeEach
    void setUp() {
        parser = mock(SourceParser.class);
        configService = new ConfigService();
        configService.setConfigValue(ConfigService.ADD_PACKAGE_DECLARATION, false);
        pluginRegistry = new PluginRegistry();

        service = new TransformationService();
        service.parser = parser;
        service.configService = configService;
        service.pluginRegistry = pluginRegistry;
    }

    private static ModuleNode simpleModule() {
        return module(assign("x", integer(1)));
    }

    // ========== SUCCESS TESTS ==========

    @Test
    void transformsParsedSource() {
        // Given
        when(parser.parse(SOURCE)).thenReturn(simpleModule());

        // When
        TransformationResult result = service.transform(SOURCE);

        // Then
        assertTrue(result.isSuccess());
        assertFalse(result.isFromCache());
        assertEquals("int x = 1;\n", result.getRenderedText());
        assertEquals(SOURCE, result.getSourceText());
        assertFalse(result.hasAstTree());
    }

    @Test
    void preParsedTreeSkipsTheParser() {
        TransformationResult result = service.transform(SOURCE, simpleModule());

        assertTrue(result.isSuccess());
        assertEquals("int x = 1;\n", result.getRenderedText());
        verifyNoInteractions(parser);
    }

    @Test
    void diagnosticsAreCarriedInTheResult() {
        String source = "print(sorted(xs))";
        when(parser.parse(source)).thenReturn(module(expr(call("print", call("sorted", name("xs"))))));

        TransformationResult result = service.transform(source);

        assertTrue(result.isSuccess());
        assertTrue(result.hasDiagnostics(DiagnosticCode.UNMAPPED_CONSTRUCT));
        assertEquals(1, result.countDiagnostics(DiagnosticCode.UNMAPPED_CONSTRUCT));
    }

    // ========== CACHE TESTS ==========

    @Test
    void repeatedSourceIsServedFromCache() {
        // Given
        when(parser.parse(SOURCE)).thenReturn(simpleModule());

        // When
        TransformationResult first = service.transform(SOURCE);
        TransformationResult second = service.transform(SOURCE);

        // Then: identical output, parsed only once
        assertFalse(first.isFromCache());
        assertTrue(second.isFromCache());
        assertEquals(first.getRenderedText(), second.getRenderedText());
        verify(parser, times(1)).parse(SOURCE);
        assertEquals(1, service.getCacheStatistics().getHits());
    }

    @Test
    void configurationChangeInvalidatesCache() {
        when(parser.parse(SOURCE)).thenReturn(simpleModule());

        service.transform(SOURCE);
        configService.setConfigValue(ConfigService.ADD_PACKAGE_DECLARATION, true);
        TransformationResult second = service.transform(SOURCE);

        assertFalse(second.isFromCache());
        assertTrue(second.getRenderedText().startsWith("package pythva.generated;"));
        verify(parser, times(2)).parse(SOURCE);
    }

    @Test
    void pluginRegistrationInvalidatesCache() {
        when(parser.parse(SOURCE)).thenReturn(simpleModule());

        service.transform(SOURCE);
        pluginRegistry.register(TestPlugin.of("noop", r -> r.afterRender(0, (node, text, ctx) -> text)));
        TransformationResult second = service.transform(SOURCE);

        assertFalse(second.isFromCache());
        verify(parser, times(2)).parse(SOURCE);
    }

    @Test
    void zeroCapacityNeverCaches() {
        when(parser.parse(SOURCE)).thenReturn(simpleModule());
        configService.setConfigValue(ConfigService.CACHE_CAPACITY, "0");

        service.transform(SOURCE);
        TransformationResult second = service.transform(SOURCE);

        assertTrue(second.isSuccess());
        assertFalse(second.isFromCache());
        verify(parser, times(2)).parse(SOURCE);
    }

    @Test
    void clearCacheForcesRecomputation() {
        when(parser.parse(SOURCE)).thenReturn(simpleModule());

        service.transform(SOURCE);
        service.clearCache();
        TransformationResult second = service.transform(SOURCE);

        assertFalse(second.isFromCache());
        verify(parser, times(2)).parse(SOURCE);
    }

    @Test
    void includeAstBypassesCache() {
        when(parser.parse(SOURCE)).thenReturn(simpleModule());

        TransformationResult first = service.transform(SOURCE, true);
        TransformationResult second = service.transform(SOURCE, true);

        assertTrue(first.hasAstTree());
        assertTrue(first.getAstTree().contains("[TYPE: Integer]"));
        assertFalse(second.isFromCache());
        verify(parser, times(2)).parse(SOURCE);
    }

    // ========== CACHE FILE TESTS ==========

    @Test
    void savedCacheServesANewService(@TempDir Path tempDir) throws IOException {
        // Given: one conversion saved to the configured file
        configService.setConfigValue(ConfigService.CACHE_FILE, tempDir.resolve("cache.json").toString());
        when(parser.parse(SOURCE)).thenReturn(simpleModule());
        service.transform(SOURCE);
        assertEquals(1, service.saveCache());

        // When: a new service with the same configuration converts the same source
        SourceParser otherParser = mock(SourceParser.class);
        TransformationService restarted = new TransformationService();
        restarted.parser = otherParser;
        restarted.configService = configService;
        restarted.pluginRegistry = new PluginRegistry();
        TransformationResult result = restarted.transform(SOURCE);

        // Then
        assertTrue(result.isFromCache());
        assertEquals("int x = 1;\n", result.getRenderedText());
        verifyNoInteractions(otherParser);
    }

    @Test
    void saveWithoutCacheFileWritesNothing() throws IOException {
        service.transform(SOURCE, simpleModule());

        assertEquals(0, service.saveCache());
    }

    @Test
    void unreadableCacheFileStartsEmpty(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("cache.json");
        Files.write(file, "[1, 2".getBytes(StandardCharsets.UTF_8));
        configService.setConfigValue(ConfigService.CACHE_FILE, file.toString());

        TransformationResult result = service.transform(SOURCE, simpleModule());

        assertTrue(result.isSuccess());
        assertFalse(result.isFromCache());
    }

    // ========== METRICS TESTS ==========

    @Test
    void everyTransformIsTimed() {
        // Given
        when(parser.parse(SOURCE)).thenReturn(simpleModule());

        // When: a conversion, a cache hit and a failure
        service.transform(SOURCE);
        service.transform(SOURCE);
        service.transform(null);

        // Then
        ConversionMetrics metrics = service.getConversionMetrics();
        assertEquals(3, metrics.getConversions());
        assertEquals(1, metrics.getFailures());
        assertTrue(metrics.getTotalTime().compareTo(metrics.getAverageTime()) >= 0);
        assertEquals(metrics.getTotalTime().toNanos() / 3, metrics.getAverageTime().toNanos());
    }

    @Test
    void metricsStartAtZero() {
        ConversionMetrics metrics = service.getConversionMetrics();

        assertEquals(0, metrics.getConversions());
        assertEquals(Duration.ZERO, metrics.getAverageTime());
        assertEquals(Duration.ZERO, metrics.getTotalTime());
    }

    // ========== FAILURE TESTS ==========

    @Test
    void nullSourceIsRejected() {
        TransformationResult result = service.transform(null);

        assertTrue(result.isFailure());
        assertEquals("Source text cannot be null", result.getErrorMessage());
        verifyNoInteractions(parser);
    }

    @Test
    void missingParserWithoutTreeFails() {
        service.parser = null;

        TransformationResult result = service.transform(SOURCE);

        assertTrue(result.isFailure());
        assertTrue(result.getErrorMessage().contains("No source parser"));
    }

    @Test
    void syntaxErrorKeepsItsSpan() {
        // Given
        SourceSpan span = new SourceSpan(2, 4, 2, 8);
        when(parser.parse(anyString())).thenThrow(new MalformedInputException("unexpected indent", span));

        // When
        TransformationResult result = service.transform("if x:\n    y");

        // Then
        assertTrue(result.isFailure());
        assertTrue(result.getErrorMessage().contains("unexpected indent"));
        assertEquals(span, result.getErrorSpan());
        assertNull(result.getRenderedText());
    }

    @Test
    void failedConversionIsNotCached() {
        when(parser.parse(SOURCE))
                .thenThrow(new MalformedInputException("broken", SourceSpan.UNKNOWN))
                .thenReturn(simpleModule());

        TransformationResult first = service.transform(SOURCE);
        TransformationResult second = service.transform(SOURCE);

        assertTrue(first.isFailure());
        assertTrue(second.isSuccess());
        assertFalse(second.isFromCache());
    }

    @Test
    void unexpectedParserErrorIsReported() {
        when(parser.parse(anyString())).thenThrow(new IllegalStateException("parser crashed"));

        TransformationResult result = service.transform(SOURCE);

        assertTrue(result.isFailure());
        assertEquals("Unexpected error: parser crashed", result.getErrorMessage());
    }

    @Test
    void invalidConfigurationIsReported() {
        configService.setConfigValue(ConfigService.INDENT_SIZE, 0);

        TransformationResult result = service.transform(SOURCE, simpleModule());

        assertTrue(result.isFailure());
        assertTrue(result.getErrorMessage().startsWith("Invalid configuration: "));
    }

    @Test
    void malformedTreeIsReported() {
        ModuleNode broken = module(assign("x", null));

        TransformationResult result = service.transform(SOURCE, broken);

        assertTrue(result.isFailure());
        assertTrue(result.getErrorMessage().contains("missing assigned value"));
    }
}
