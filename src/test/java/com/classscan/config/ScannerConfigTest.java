package com.classscan.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.classscan.text.ClassTokenScanner;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ScannerConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        ScannerConfig config = ScannerConfig.defaults();

        assertEquals(Constants.DEFAULT_SEPARATOR, config.getSeparator());
        assertFalse(config.isHandleBrackets());
        assertEquals(Constants.DEFAULT_OPEN_CHARS, config.getOpenChars());
        assertEquals(Constants.DEFAULT_CLOSE_CHARS, config.getCloseChars());
        assertFalse(config.isHandleImportant());
        assertEquals(Constants.DEFAULT_IMPORTANT_MARKER, config.getImportantMarker());
        assertFalse(config.isHoverMode());
        assertTrue(config.isGreedy());
        assertEquals(Constants.MAX_NESTING_DEPTH, config.getMaxNestingDepth());
        assertDoesNotThrow(config::validate);
    }

    @Test
    void testSetters() {
        ScannerConfig config = new ScannerConfig();

        config.setSeparator("_");
        config.setHandleBrackets(true);
        config.setOpenChars("[{");
        config.setCloseChars("]}");
        config.setHandleImportant(true);
        config.setImportantMarker('*');
        config.setHoverMode(true);
        config.setGreedy(false);
        config.setMaxNestingDepth(4);

        assertEquals("_", config.getSeparator());
        assertTrue(config.isHandleBrackets());
        assertEquals("[{", config.getOpenChars());
        assertEquals("]}", config.getCloseChars());
        assertTrue(config.isHandleImportant());
        assertEquals('*', config.getImportantMarker());
        assertTrue(config.isHoverMode());
        assertFalse(config.isGreedy());
        assertEquals(4, config.getMaxNestingDepth());
        assertDoesNotThrow(config::validate);
    }

    @Test
    @DisplayName("twin 预设覆盖分隔符并开启括号与 important")
    void testTwinPreset() {
        ScannerConfig config = ScannerConfig.defaults();
        config.setSeparator("_");
        config.applyTwin();

        assertEquals(":", config.getSeparator());
        assertTrue(config.isHandleBrackets());
        assertTrue(config.isHandleImportant());
        assertEquals(":", ScannerConfig.twin().getSeparator());
    }

    @Test
    @DisplayName("copy 与原配置互不影响")
    void testCopyIsIndependent() {
        ScannerConfig original = ScannerConfig.twin();
        ScannerConfig copy = original.copy();
        copy.setHoverMode(true);
        copy.setSeparator("--");

        assertFalse(original.isHoverMode());
        assertEquals(":", original.getSeparator());
        assertTrue(copy.isHandleBrackets());
    }

    @ParameterizedTest(name = "separator=\"{0}\"")
    @ValueSource(strings = {"", " ", "a b", "\t"})
    @DisplayName("空分隔符或含空白的分隔符被拒绝")
    void testInvalidSeparator(String separator) {
        ScannerConfig config = ScannerConfig.defaults();
        config.setSeparator(separator);

        ScannerConfigException exception = assertThrows(ScannerConfigException.class, () -> new ClassTokenScanner(config));
        assertEquals("separator", exception.getOption());
        assertEquals(separator, exception.getValue());
    }

    @Test
    void testNullSeparatorRejected() {
        ScannerConfig config = ScannerConfig.defaults();
        config.setSeparator(null);

        assertThrows(ScannerConfigException.class, config::validate);
    }

    @Test
    @DisplayName("括号配置校验")
    void testInvalidBrackets() {
        ScannerConfig emptyOpen = bracketConfig("", ")");
        assertEquals("openChars", assertThrows(ScannerConfigException.class, emptyOpen::validate).getOption());

        ScannerConfig emptyClose = bracketConfig("(", "");
        assertEquals("closeChars", assertThrows(ScannerConfigException.class, emptyClose::validate).getOption());

        ScannerConfig overlapping = bracketConfig("([", "[)");
        assertThrows(ScannerConfigException.class, overlapping::validate);

        ScannerConfig whitespace = bracketConfig("( ", ")");
        assertThrows(ScannerConfigException.class, whitespace::validate);

        ScannerConfig separatorWithBracket = bracketConfig("(", ")");
        separatorWithBracket.setSeparator(")");
        assertEquals("separator", assertThrows(ScannerConfigException.class, separatorWithBracket::validate).getOption());
    }

    @Test
    @DisplayName("未开启括号处理时不校验括号字符")
    void testBracketsIgnoredWhenDisabled() {
        ScannerConfig config = ScannerConfig.defaults();
        config.setOpenChars("");
        config.setCloseChars("");

        assertDoesNotThrow(config::validate);
    }

    @Test
    void testInvalidImportantMarkerAndDepth() {
        ScannerConfig whitespaceMarker = ScannerConfig.defaults();
        whitespaceMarker.setHandleImportant(true);
        whitespaceMarker.setImportantMarker(' ');
        assertThrows(ScannerConfigException.class, whitespaceMarker::validate);

        ScannerConfig markerInSeparator = ScannerConfig.defaults();
        markerInSeparator.setHandleImportant(true);
        markerInSeparator.setSeparator("!");
        assertEquals("importantMarker", assertThrows(ScannerConfigException.class, markerInSeparator::validate).getOption());

        ScannerConfig zeroDepth = ScannerConfig.defaults();
        zeroDepth.setMaxNestingDepth(0);
        assertThrows(ScannerConfigException.class, zeroDepth::validate);
    }

    @Test
    @DisplayName("从JSON文件加载配置，忽略未知字段")
    void testLoadFromJson() throws IOException {
        Path configFile = tempDir.resolve("scanner.json");
        Files.writeString(configFile, """
            {
              "separator": "_",
              "handleBrackets": true,
              "openChars": "[",
              "closeChars": "]",
              "importantMarker": "*",
              "theme": { "colors": {} }
            }
            """);

        ScannerConfig config = ScannerConfig.load(configFile);

        assertEquals("_", config.getSeparator());
        assertTrue(config.isHandleBrackets());
        assertEquals("[", config.getOpenChars());
        assertEquals("]", config.getCloseChars());
        assertEquals('*', config.getImportantMarker());
        assertFalse(config.isHandleImportant());
        assertTrue(config.isGreedy());
    }

    @Test
    void testLoadMissingFileFails() {
        Path missing = tempDir.resolve("missing.json");

        ScannerConfigException exception = assertThrows(ScannerConfigException.class, () -> ScannerConfig.load(missing));
        assertEquals("config", exception.getOption());
        assertInstanceOf(IOException.class, exception.getCause());
    }

    @Test
    void testLoadMalformedJsonFails() throws IOException {
        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{ \"separator\": ");

        assertThrows(ScannerConfigException.class, () -> ScannerConfig.load(broken));
    }

    @Test
    @DisplayName("内容为 JSON null 的配置文件报配置错误")
    void testLoadNullLiteralFails() throws IOException {
        Path nullFile = tempDir.resolve("null.json");
        Files.writeString(nullFile, "null");

        ScannerConfigException exception = assertThrows(ScannerConfigException.class, () -> ScannerConfig.load(nullFile));
        assertEquals("config", exception.getOption());
        assertTrue(exception.getMessage().contains("配置文件内容为空"));
    }

    private static ScannerConfig bracketConfig(String openChars, String closeChars) {
        ScannerConfig config = ScannerConfig.defaults();
        config.setHandleBrackets(true);
        config.setOpenChars(openChars);
        config.setCloseChars(closeChars);
        return config;
    }
}
