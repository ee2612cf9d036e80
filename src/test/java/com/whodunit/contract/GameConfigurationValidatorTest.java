package com.whodunit.contract;

import com.whodunit.GameFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GameConfigurationValidatorTest {

    private GameConfigurationValidator validator;

    @BeforeEach
    void setUp() {
        validator = new GameConfigurationValidator();
    }

    @Test
    void defaultConfiguration_isValid() {
        assertDoesNotThrow(() -> validator.validate(GameFixtures.defaultConfiguration()));
    }

    @Test
    void nullConfiguration_isRejected() {
        assertThrows(ConfigurationException.class, () -> validator.validate(null));
    }

    @Nested
    @DisplayName("Names")
    class Names {

        @Test
        void singlePerson_isRejected() {
            GameConfiguration config = withNames(List.of("Joe"));
            ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> validator.validate(config));
            assertTrue(ex.getMessage().contains("at least 2"));
        }

        @Test
        void missingNames_isRejected() {
            GameConfiguration config = withNames(null);
            assertThrows(ConfigurationException.class, () -> validator.validate(config));
        }

        @Test
        void duplicateName_isRejected() {
            GameConfiguration config = withNames(List.of("Joe", "John", "Joe"));
            ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> validator.validate(config));
            assertTrue(ex.getMessage().contains("duplicate"));
        }

        @Test
        void blankName_isRejected() {
            GameConfiguration config = withNames(Arrays.asList("Joe", " "));
            assertThrows(ConfigurationException.class, () -> validator.validate(config));
        }

        @Test
        void twoPeople_areEnough() {
            GameConfiguration config = withNames(List.of("Joe", "John"));
            assertDoesNotThrow(() -> validator.validate(config));
        }
    }

    @Nested
    @DisplayName("Attribute categories")
    class Categories {

        @Test
        void emptyCategory_isRejected() {
            GameConfiguration base = GameFixtures.defaultConfiguration();
            GameConfiguration config = new GameConfiguration(base.names(), base.technologies(), base.places(),
                base.companies(), base.institutions(), List.of(), base.materials());
            ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> validator.validate(config));
            assertTrue(ex.getMessage().contains("food"));
        }

        @Test
        void nullValue_isRejected() {
            GameConfiguration base = GameFixtures.defaultConfiguration();
            GameConfiguration config = new GameConfiguration(base.names(), base.technologies(), base.places(),
                base.companies(), base.institutions(), base.foods(), Arrays.asList("wood", null));
            assertThrows(ConfigurationException.class, () -> validator.validate(config));
        }

        @Test
        void valueSharedAcrossCategories_isRejected() {
            GameConfiguration base = GameFixtures.defaultConfiguration();
            GameConfiguration config = new GameConfiguration(base.names(), base.technologies(), base.places(),
                List.of("Google", "company"), base.institutions(), base.foods(), base.materials());
            ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> validator.validate(config));
            assertTrue(ex.getMessage().contains("company"));
        }

        @Test
        void reservedKillerValue_isRejected() {
            GameConfiguration base = GameFixtures.defaultConfiguration();
            GameConfiguration config = new GameConfiguration(base.names(), base.technologies(), base.places(),
                base.companies(), base.institutions(), base.foods(), List.of("wood", "is_killer"));
            assertThrows(ConfigurationException.class, () -> validator.validate(config));
        }

        @Test
        void singleValueCategories_areAllowed() {
            assertDoesNotThrow(() -> validator.validate(GameFixtures.colorConfiguration()));
        }
    }

    @Nested
    @DisplayName("Atom keys")
    class AtomKeys {

        @Test
        void underscoreInNameAndValue_producingSameKey_isRejected() {
            GameConfiguration config = new GameConfiguration(
                List.of("A", "A_x"), List.of("tech"), List.of("town"), List.of("firm"),
                List.of("school"), List.of("soup"), List.of("x_red", "red"));

            ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> validator.validate(config));
            assertTrue(ex.getMessage().contains("A_x_red"), ex.getMessage());
        }

        @Test
        void attributeKeyMatchingKillerKey_isRejected() {
            // "A_is" + "killer" reads the same as "A is the killer"
            GameConfiguration config = new GameConfiguration(
                List.of("A", "A_is"), List.of("tech"), List.of("town"), List.of("firm"),
                List.of("school"), List.of("soup"), List.of("killer", "steel"));

            ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> validator.validate(config));
            assertTrue(ex.getMessage().contains("A_is_killer"), ex.getMessage());
        }

        @Test
        void underscoresWithoutCollision_areAllowed() {
            GameConfiguration config = new GameConfiguration(
                List.of("Joe_1", "Joe_2"), List.of("tech"), List.of("town"), List.of("firm"),
                List.of("school"), List.of("soup"), List.of("dark_red", "light_blue"));

            assertDoesNotThrow(() -> validator.validate(config));
        }
    }

    private static GameConfiguration withNames(List<String> names) {
        GameConfiguration base = GameFixtures.defaultConfiguration();
        return new GameConfiguration(names, base.technologies(), base.places(), base.companies(),
            base.institutions(), base.foods(), base.materials());
    }
}
