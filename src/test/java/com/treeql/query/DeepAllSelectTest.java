package com.treeql.query;

import com.treeql.TreeQLLoggingConfig;
import com.treeql.json.JsonNode;
import com.treeql.statement.Predicate;
import com.treeql.statement.SelectStatement;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deep selection ({@code "**"}) at every depth of the tree.
 */
public class DeepAllSelectTest extends TreeQLLoggingConfig {

    private final SelectEngine engine = new SelectEngine();

    private JsonNode select(String data, String statement) {
        return engine.select(json(data), selectOf(statement)).orElse(JsonNode.MISSING);
    }

    @Nested
    class FieldProjection {

        @Test
        public void testProjectsFieldsAtAnyDepth() {
            String data = """
                    {"a": {"id": "A1", "name": "Item A",
                           "b": {"id": "B1", "c": {"id": "C1", "name": "Item C"}}},
                     "d": {"id": "D1"}}""";

            assertJson("""
                    {"a": {"id": "A1", "b": {"id": "B1", "c": {"id": "C1"}}}, "d": {"id": "D1"}}""",
                    select(data, "{\"**\": {\"id\": true}}"));
        }

        @Test
        public void testProjectsEachFieldIndependently() {
            String data = """
                    {"users": {
                      "john": {"name": "John", "age": 30},
                      "jane": {"name": "Jane", "email": "jane@example.com"},
                      "bob": {"age": 25, "email": "bob@example.com"}}}""";

            assertJson("""
                    {"users": {"john": {"name": "John"},
                               "jane": {"name": "Jane", "email": "jane@example.com"},
                               "bob": {"email": "bob@example.com"}}}""",
                    select(data, "{\"**\": {\"name\": true, \"email\": true}}"));
        }

        @Test
        public void testProjectedContainersAreTakenWhole() {
            String data = """
                    {"company": {
                      "info": {"name": "TechCorp", "address": {"street": "123 Main St", "city": "San Francisco"}},
                      "departments": {"engineering": {"address": {"building": "A", "floor": 3}}}}}""";

            assertJson("""
                    {"company": {
                      "info": {"address": {"street": "123 Main St", "city": "San Francisco"}},
                      "departments": {"engineering": {"address": {"building": "A", "floor": 3}}}}}""",
                    select(data, "{\"**\": {\"address\": true}}"));
        }

        @Test
        public void testNothingFound() {
            assertEquals(JsonNode.MISSING, select("{\"a\": {}, \"b\": {\"c\": {}}}", "{\"**\": {\"id\": true}}"));
        }

        @Test
        public void testArrays() {
            String data = "{\"items\": [{\"id\": 1, \"name\": \"First\"}, {\"id\": 2, \"name\": \"Second\"}, {\"id\": 3, \"name\": \"Third\"}]}";

            assertJson("{\"items\": [{\"id\": 1}, {\"id\": 2}, {\"id\": 3}]}", select(data, "{\"**\": {\"id\": true}}"));
        }

        @Test
        public void testScalarsAreNotTraversed() {
            String data = "{\"text\": \"This is a string with id inside\", \"number\": 12345, \"object\": {\"id\": \"real-id\"}}";

            assertJson("{\"object\": {\"id\": \"real-id\"}}", select(data, "{\"**\": {\"id\": true}}"));
        }
    }

    @Nested
    class WhereOnly {

        @Test
        public void testReturnsMatchingObjectsWhole() {
            String data = """
                    {"catalog": {"books": {
                      "fiction": {"title": "The Great Novel", "author": "Jane Doe", "price": 20},
                      "science": {"title": "Physics 101", "author": "Dr. Smith", "price": 50}}}}""";

            assertJson("""
                    {"catalog": {"books": {"science": {"title": "Physics 101", "author": "Dr. Smith", "price": 50}}}}""",
                    select(data, "{\"**\": {\"?\": {\"price\": {\">\": 30}}}}"));
        }

        @Test
        public void testMatchesSpecificFieldValue() {
            String data = "{\"level1\": {\"id\": \"L1\", \"level2\": {\"name\": \"Orange Juice\", \"price\": 100}}}";

            assertJson("{\"level1\": {\"level2\": {\"name\": \"Orange Juice\", \"price\": 100}}}",
                    select(data, "{\"**\": {\"?\": {\"name\": {\"==\": \"Orange Juice\"}}}}"));
        }

        @Test
        public void testValuePatternMatchesScalars() {
            String data = """
                    {"products": {
                      "item1": {"name": "Coffee", "description": "Dark roast"},
                      "item2": {"name": "Orange Tea", "description": "Citrus blend"},
                      "item3": {"name": "Green Tea", "description": "Light and fresh"}}}""";

            assertJson("{\"products\": {\"item2\": {\"name\": \"Orange Tea\"}}}",
                    select(data, "{\"**\": {\"?\": {\"~\": \"/orange/i\"}}}"));
            assertJson("{\"products\": {\"item2\": {\"name\": \"Orange Tea\", \"description\": \"Citrus blend\"}}}",
                    select(data, "{\"**\": {\"?\": {\"name\": {\"~\": \"/orange/i\"}}}}"));
        }

        @Test
        public void testFilteredArraysAreDense() {
            String data = "{\"items\": [{\"p\": 1}, {\"p\": 50}, {\"p\": 60}]}";

            assertEquals("{\"items\":[{\"p\":50},{\"p\":60}]}",
                    compact(select(data, "{\"**\": {\"?\": {\"p\": {\">\": 30}}}}")));
        }

        @Test
        public void testNestedAndTopLevelArraysAreDense() {
            String nested = "{\"groups\": [[{\"p\": 1}, {\"p\": 50}], [{\"p\": 2}], [{\"p\": 70}]]}";
            assertEquals("{\"groups\":[[{\"p\":50}],[{\"p\":70}]]}",
                    compact(select(nested, "{\"**\": {\"?\": {\"p\": {\">\": 30}}}}")));

            assertEquals("[{\"p\":50}]",
                    compact(select("[{\"p\": 1}, {\"p\": 50}]", "{\"**\": {\"?\": {\"p\": {\">\": 30}}}}")));
        }
    }

    @Nested
    class WhereWithProjection {

        @Test
        public void testProjectsFieldsNextToMatch() {
            String data = """
                    {"products": {
                      "item1": {"name": "Coffee", "price": 5, "stock": 100},
                      "item2": {"name": "Orange Tea", "price": 8, "stock": 50},
                      "item3": {"name": "Green Tea", "price": 6, "stock": 75}}}""";

            assertJson("{\"products\": {\"item2\": {\"name\": \"Orange Tea\", \"price\": 8, \"stock\": 50}}}",
                    select(data, "{\"**\": {\"?\": {\"~\": \"Orange\"}, \"price\": true, \"stock\": true}}"));
        }

        @Test
        public void testProjectsFromAncestorOfDeepMatch() {
            String data = """
                    {"product": {"id": "P123", "sku": "ABC-789",
                                 "details": {"name": "Fresh Orange Juice", "description": "100% natural"}}}""";

            assertJson("""
                    {"product": {"details": {"name": "Fresh Orange Juice"}, "id": "P123", "sku": "ABC-789"}}""",
                    select(data, "{\"**\": {\"?\": {\"~\": \"Orange\"}, \"id\": true, \"sku\": true}}"));
        }

        @Test
        public void testMatchesAtSeveralDepths() {
            String data = """
                    {"store": {"name": "Orange Store", "id": "S1", "location": "Downtown",
                               "products": {
                                 "juice": {"name": "Orange Juice", "id": "P1", "price": 5},
                                 "tea": {"name": "Green Tea", "id": "P2", "price": 3}}}}""";

            assertJson("""
                    {"store": {"name": "Orange Store", "id": "S1", "location": "Downtown",
                               "products": {"juice": {"name": "Orange Juice", "id": "P1"}}}}""",
                    select(data, "{\"**\": {\"?\": {\"~\": \"Orange\"}, \"id\": true, \"location\": true}}"));
        }

        @Test
        public void testMatchedObjectIsWhole() {
            String data = """
                    {"catalog": {"books": {
                      "item1": {"title": "Learn TypeScript", "isbn": "123", "price": 30},
                      "item2": {"title": "JavaScript Guide", "price": 25},
                      "item3": {"title": "Node.js Mastery", "isbn": "789", "price": 35}}}}""";

            assertJson("""
                    {"catalog": {"books": {"item3": {"title": "Node.js Mastery", "price": 35, "isbn": "789"}}}}""",
                    select(data, "{\"**\": {\"?\": {\"price\": {\">\": 30}}, \"isbn\": true}}"));
        }

        @Test
        public void testSearchTextAndCollectIdentifiers() {
            String data = """
                    {"products": {
                      "p1": {"id": "PROD-001", "name": "Organic Orange Juice", "description": "Fresh and natural"},
                      "p2": {"id": "PROD-002", "name": "Apple Juice", "description": "Made from organic apples"},
                      "p3": {"id": "PROD-003", "name": "Grape Juice", "description": "Sweet grape flavor"}}}""";

            assertJson("""
                    {"products": {
                      "p1": {"id": "PROD-001", "name": "Organic Orange Juice"},
                      "p2": {"id": "PROD-002", "description": "Made from organic apples"}}}""",
                    select(data, "{\"**\": {\"?\": {\"~\": \"/organic/i\"}, \"id\": true}}"));
        }
    }

    @Nested
    class Predicates {

        @Test
        public void testSeveralFieldConditions() {
            String data = """
                    {"inventory": {
                      "item1": {"name": "Laptop", "price": 1000, "stock": 5},
                      "item2": {"name": "Mouse", "price": 50, "stock": 100},
                      "item3": {"name": "Keyboard", "price": 150, "stock": 0},
                      "item4": {"name": "Monitor", "price": 500, "stock": 10}}}""";

            assertJson("{\"inventory\": {\"item2\": {\"name\": \"Mouse\", \"price\": 50, \"stock\": 100}}}",
                    select(data, "{\"**\": {\"?\": {\"price\": {\"<\": 200}, \"stock\": {\">\": 0}}, \"name\": true}}"));
        }

        @Test
        public void testNotExcludesAncestorsWithoutTheField() {
            String data = """
                    {"users": {
                      "u1": {"name": "Alice", "status": "active"},
                      "u2": {"name": "Bob", "status": "inactive"},
                      "u3": {"name": "Charlie", "status": "active"}}}""";

            assertJson("""
                    {"users": {"u1": {"name": "Alice", "status": "active"}, "u3": {"name": "Charlie", "status": "active"}}}""",
                    select(data, "{\"**\": {\"?\": {\"status\": {\"!\": [\"inactive\", {\"==\": null}]}}, \"name\": true}}"));
        }

        @Test
        public void testNullMatchesMissingFields() {
            String data = """
                    {"records": {
                      "r1": {"id": 1, "value": null},
                      "r3": {"id": 3, "value": "data"},
                      "r4": {"id": 4}}}""";

            assertJson("{\"records\": {\"r1\": {\"id\": 1, \"value\": null}, \"r4\": {\"id\": 4}}}",
                    select(data, "{\"**\": {\"?\": {\"value\": {\"==\": null}, \"id\": {\"!=\": null}}, \"id\": true}}"));
        }

        @Test
        public void testAncestorsWithoutTheFieldMatchFuzzily() {
            String data = "{\"records\": {\"r1\": {\"id\": 1, \"value\": \"x\"}}}";

            // "records" has no "value", which counts as null
            assertJson("{\"records\": {\"r1\": {\"id\": 1, \"value\": \"x\"}}}",
                    select(data, "{\"**\": {\"?\": {\"value\": {\"==\": null}}}}"));
        }

        @Test
        public void testRequiredFieldsWithNotMissing() {
            String data = """
                    {"items": {
                      "a": {"price": 10, "stock": 5},
                      "b": {"price": 20},
                      "c": {"stock": 10},
                      "d": {"price": 30, "stock": 0, "discount": 0.1}}}""";
            Predicate present = Predicate.not(Predicate.literal(JsonNode.MISSING));
            SelectStatement statement = SelectStatement.shape()
                    .deepAll(SelectStatement.shape()
                            .where(Predicate.builder().field("price", present).field("stock", present).build())
                            .build())
                    .build();

            assertJson("""
                    {"items": {"a": {"price": 10, "stock": 5}, "d": {"price": 30, "stock": 0, "discount": 0.1}}}""",
                    engine.select(json(data), statement).orElseThrow());
        }
    }

    @Nested
    class Combined {

        @Test
        public void testWithRegularFieldsAtSameLevel() {
            String data = """
                    {"metadata": {"version": "1.0", "author": "System"},
                     "stores": {
                       "downtown": {"inventory": {"electronics": {"count": 50, "value": 10000},
                                                  "books": {"count": 200, "value": 5000}}, "staff": 10},
                       "uptown": {"inventory": {"electronics": {"count": 30, "value": 15000},
                                                "books": {"count": 500, "value": 3000}}, "staff": 8}}}""";
            String statement = """
                    {"metadata": true,
                     "stores": {"**": {"?": {"value": {">": 9000}}, "count": true, "value": true}}}""";

            assertJson("""
                    {"metadata": {"version": "1.0", "author": "System"},
                     "stores": {
                       "downtown": {"inventory": {"electronics": {"count": 50, "value": 10000}}},
                       "uptown": {"inventory": {"electronics": {"count": 30, "value": 15000}}}}}""",
                    select(data, statement));
        }

        @Test
        public void testNestedDeepSelection() {
            String data = """
                    {"regions": {
                      "north": {"stores": {"s1": {"manager": {"name": "Alice", "level": 3}},
                                           "s2": {"manager": {"name": "Bob", "level": 2}}}},
                      "south": {"stores": {"s3": {"manager": {"name": "Charlie", "level": 3}},
                                           "s4": {"manager": {"name": "David", "level": 1}}}}}}""";
            String statement = """
                    {"**": {"stores": {"**": {"?": {"level": {">": 2}}, "name": true}}}}""";

            assertJson("""
                    {"regions": {
                      "north": {"stores": {"s1": {"manager": {"name": "Alice", "level": 3}}}},
                      "south": {"stores": {"s3": {"manager": {"name": "Charlie", "level": 3}}}}}}""",
                    select(data, statement));
        }

        @Test
        public void testDeepAndAllMergeAtSameLevel() {
            String data = "{\"a\": {\"id\": 1, \"x\": {\"id\": 2, \"y\": 3}}, \"b\": {\"z\": 4}}";

            assertJson("{\"a\": {\"id\": 1, \"x\": {\"id\": 2, \"y\": 3}}, \"b\": {\"z\": 4}}",
                    select(data, "{\"**\": {\"id\": true}, \"*\": {\"x\": true, \"z\": true}}"));
        }
    }
}
