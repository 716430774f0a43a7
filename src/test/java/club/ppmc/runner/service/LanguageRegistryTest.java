package club.ppmc.runner.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import club.ppmc.runner.model.LanguageSpec;
import org.junit.jupiter.api.Test;

class LanguageRegistryTest {

    private final LanguageRegistry registry = LanguageRegistry.defaults("sqlite3");

    @Test
    void shouldListDefaultLanguagesInOrder() {
        assertThat(registry.supportedLanguages()).containsExactly("python", "c", "cpp", "java", "js", "php", "sql");
    }

    @Test
    void shouldRenderCompileAndRunCommand() {
        LanguageSpec cpp = registry.find("cpp").orElseThrow();

        assertEquals("user_code.cpp", cpp.sourceFileName(cpp.defaultStem()));
        assertEquals("g++ -fdiagnostics-color=never 'user_code.cpp' -o main && ./main",
                cpp.render("user_code.cpp", "user_code", null));
    }

    @Test
    void shouldMarkJavaForEntryPointDiscovery() {
        LanguageSpec java = registry.find("java").orElseThrow();

        assertTrue(java.entryPointDiscovery());
        assertEquals("javac 'Main.java' && java 'Main'", java.render("Main.java", "Main", null));
    }

    @Test
    void shouldRenderQueryCommandWithStore() {
        LanguageSpec sql = registry.find("sql").orElseThrow();

        assertTrue(sql.queryLanguage());
        assertEquals("'sqlite3' '/tmp/store/ephemeral.db' < 'user_code.sql'",
                sql.render("user_code.sql", "user_code", "/tmp/store/ephemeral.db"));
    }

    @Test
    void shouldNotFindUnknownLanguage() {
        assertTrue(registry.find("ruby").isEmpty());
        assertTrue(registry.find("Python").isEmpty());
    }
}
