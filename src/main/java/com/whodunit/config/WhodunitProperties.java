package com.whodunit.config;

import com.whodunit.contract.GameConfiguration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Engine, batch and default game settings under the {@code whodunit} prefix.
 */
@Component
@ConfigurationProperties(prefix = "whodunit")
public class WhodunitProperties {

    private final Engine engine = new Engine();
    private final Batch batch = new Batch();
    private final Defaults defaults = new Defaults();

    public Engine getEngine() {
        return engine;
    }

    public Batch getBatch() {
        return batch;
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public static class Engine {

        /** Generation attempts (accepted or not) before a game is given up. */
        private int maxAttempts = 1000;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }

    public static class Batch {

        private int workers = 1;
        private int maxCount = 1000;

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public int getMaxCount() {
            return maxCount;
        }

        public void setMaxCount(int maxCount) {
            this.maxCount = maxCount;
        }
    }

    /** Game configuration used when a request does not bring its own. */
    public static class Defaults {

        private List<String> names = List.of("Joe", "John", "Bob", "Will");
        private List<String> technologies = List.of("Python", "Java", "Ruby");
        private List<String> places = List.of("China", "India", "France");
        private List<String> companies = List.of("Google", "Facebook", "Amazon", "Twitter");
        private List<String> institutions = List.of("government", "company", "system");
        private List<String> foods = List.of("pizza", "bread", "fish");
        private List<String> materials = List.of("wood", "metal", "steel");

        public GameConfiguration toConfiguration() {
            return new GameConfiguration(names, technologies, places, companies, institutions, foods, materials);
        }

        public List<String> getNames() {
            return names;
        }

        public void setNames(List<String> names) {
            this.names = names;
        }

        public List<String> getTechnologies() {
            return technologies;
        }

        public void setTechnologies(List<String> technologies) {
            this.technologies = technologies;
        }

        public List<String> getPlaces() {
            return places;
        }

        public void setPlaces(List<String> places) {
            this.places = places;
        }

        public List<String> getCompanies() {
            return companies;
        }

        public void setCompanies(List<String> companies) {
            this.companies = companies;
        }

        public List<String> getInstitutions() {
            return institutions;
        }

        public void setInstitutions(List<String> institutions) {
            this.institutions = institutions;
        }

        public List<String> getFoods() {
            return foods;
        }

        public void setFoods(List<String> foods) {
            this.foods = foods;
        }

        public List<String> getMaterials() {
            return materials;
        }

        public void setMaterials(List<String> materials) {
            this.materials = materials;
        }
    }
}
