package com.helios.transform.core.path;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class PathResolverTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final PathResolver resolver = new PathResolver();

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    private List<String> values(JsonNode document, String expression) {
        return resolver.resolve(document, expression).stream()
                .map(slot -> slot.get().toString())
                .collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Direct access")
    class DirectAccess {

        @Test
        @DisplayName("Members and indexes address a single slot")
        void memberAndIndex() throws Exception {
            JsonNode doc = json("{\"a\":{\"b\":[10,20,30]}}");

            assertThat(values(doc, "$.a.b[1]")).containsExactly("20");
            assertThat(values(doc, "$['a']['b'][0]")).containsExactly("10");
            assertThat(values(doc, "$.a.b[-1]")).containsExactly("30");
        }

        @Test
        @DisplayName("The root path yields the document itself")
        void root() throws Exception {
            JsonNode doc = json("{\"a\":1}");
            List<Slot> slots = resolver.resolve(doc, "$");

            assertThat(slots).hasSize(1);
            assertThat(slots.get(0).get()).isSameAs(doc);
        }

        @Test
        @DisplayName("Slices are end-exclusive and clamp to the array bounds")
        void slices() throws Exception {
            JsonNode doc = json("[0,1,2,3,4]");

            assertThat(values(doc, "$[1:3]")).containsExactly("1", "2");
            assertThat(values(doc, "$[:2]")).containsExactly("0", "1");
            assertThat(values(doc, "$[-2:]")).containsExactly("3", "4");
            assertThat(values(doc, "$[3:99]")).containsExactly("3", "4");
            assertThat(values(doc, "$[4:1]")).isEmpty();
        }

        @Test
        @DisplayName("Unions select in listed order")
        void unions() throws Exception {
            JsonNode doc = json("{\"a\":1,\"b\":2,\"c\":3}");
            assertThat(values(doc, "$['c','a']")).containsExactly("3", "1");

            JsonNode array = json("[\"x\",\"y\",\"z\"]");
            assertThat(values(array, "$[2,0]")).containsExactly("\"z\"", "\"x\"");
        }

        @Test
        @DisplayName("Explicit null members are matched; absent members are not")
        void nullVersusAbsent() throws Exception {
            JsonNode doc = json("{\"a\":null}");

            assertThat(values(doc, "$.a")).containsExactly("null");
            assertThat(values(doc, "$.b")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Misses")
    class Misses {

        @Test
        @DisplayName("A path that matches nothing returns an empty list and creates nothing")
        void noImplicitCreation() throws Exception {
            JsonNode doc = json("{\"a\":{\"b\":1},\"list\":[1]}");
            JsonNode before = doc.deepCopy();

            assertThat(resolver.resolve(doc, "$.x.y.z")).isEmpty();
            assertThat(resolver.resolve(doc, "$.a.b.c")).isEmpty();
            assertThat(resolver.resolve(doc, "$.list[5]")).isEmpty();
            assertThat(resolver.resolve(doc, "$.list[-2]")).isEmpty();
            assertThat(resolver.resolve(doc, "$.a[0]")).isEmpty();
            assertThat(resolver.resolve(doc, "$.list.name")).isEmpty();
            assertThat(doc).isEqualTo(before);
        }

        @Test
        @DisplayName("Wildcards over scalars select nothing")
        void wildcardOnScalar() throws Exception {
            assertThat(values(json("{\"a\":5}"), "$.a.*")).isEmpty();
            assertThat(values(json("\"text\""), "$[*]")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Canonical order")
    class CanonicalOrder {

        @Test
        @DisplayName("Wildcards visit members in insertion order and elements by index")
        void wildcardOrder() throws Exception {
            JsonNode doc = json("{\"z\":1,\"a\":2,\"m\":[3,4]}");

            assertThat(values(doc, "$.*")).containsExactly("1", "2", "[3,4]");
            assertThat(values(doc, "$.m[*]")).containsExactly("3", "4");
        }

        @Test
        @DisplayName("Recursive descent visits the node before its descendants, subtree by subtree")
        void recursiveDescentIsPreOrder() throws Exception {
            JsonNode doc = json("{\"code\":\"A\",\"nested\":{\"code\":\"B\",\"deeper\":{\"code\":\"C\"}},\"tail\":{\"code\":\"D\"}}");

            assertThat(values(doc, "$..code")).containsExactly("\"A\"", "\"B\"", "\"C\"", "\"D\"");
        }

        @Test
        @DisplayName("Recursive wildcard emits each node's children before descending into them")
        void recursiveWildcard() throws Exception {
            JsonNode doc = json("{\"a\":{\"b\":1},\"c\":[2,3]}");

            List<String> addresses = resolver.resolve(doc, "$..*").stream()
                    .map(Slot::describe)
                    .collect(Collectors.toList());

            assertThat(values(doc, "$..*")).containsExactly("{\"b\":1}", "[2,3]", "1", "2", "3");
            assertThat(addresses).containsExactly("['a']", "['c']", "['b']", "[0]", "[1]");
        }

        @Test
        @DisplayName("Recursive descent followed by an array wildcard crosses mixed containers deterministically")
        void recursiveDescentWithArrayWildcard() throws Exception {
            JsonNode doc = json("""
                    {
                      "items": [1, {"items": [2, 3]}],
                      "other": {"items": [4]},
                      "items2": {"items": "not-an-array"}
                    }
                    """);

            assertThat(values(doc, "$..items[*]"))
                    .containsExactly("1", "{\"items\":[2,3]}", "2", "3", "4");
        }

        @Test
        @DisplayName("Recursive descent includes array elements at every depth")
        void recursiveIntoArrays() throws Exception {
            JsonNode doc = json("[{\"id\":1},[{\"id\":2}],{\"child\":{\"id\":3}}]");

            assertThat(values(doc, "$..id")).containsExactly("1", "2", "3");
        }

        @Test
        @DisplayName("Resolution is repeatable")
        void deterministic() throws Exception {
            JsonNode doc = json("{\"a\":[{\"v\":1},{\"v\":2}],\"b\":{\"v\":3}}");

            assertThat(values(doc, "$..v")).isEqualTo(values(doc, "$..v"));
        }
    }

    @Nested
    @DisplayName("Filters")
    class Filters {

        private final String orders = """
                {"orders": [
                  {"id": 1, "qty": 5, "status": "open"},
                  {"id": 2, "qty": 0, "status": "open"},
                  {"id": 3, "qty": "7", "status": "closed"},
                  {"id": 4, "status": "open", "email": "a@b.c"}
                ]}
                """;

        @Test
        @DisplayName("Comparisons select matching elements in index order")
        void comparison() throws Exception {
            JsonNode doc = json(orders);

            assertThat(values(doc, "$.orders[?(@.status == 'open')].id")).containsExactly("1", "2", "4");
            assertThat(values(doc, "$.orders[?(@.qty >= 1)].id")).containsExactly("1");
        }

        @Test
        @DisplayName("Filter comparisons never coerce across types")
        void strictTyping() throws Exception {
            JsonNode doc = json(orders);

            // "7" is a string, so it is neither > 1 nor != 0
            assertThat(values(doc, "$.orders[?(@.qty > 1)].id")).containsExactly("1");
            assertThat(values(doc, "$.orders[?(@.qty != 0)].id")).containsExactly("1");
        }

        @Test
        @DisplayName("Existence tests and boolean combinations")
        void existenceAndCombination() throws Exception {
            JsonNode doc = json(orders);

            assertThat(values(doc, "$.orders[?(@.email)].id")).containsExactly("4");
            assertThat(values(doc, "$.orders[?(@.status == 'open' && @.qty > 0)].id")).containsExactly("1");
            assertThat(values(doc, "$.orders[?(@.id == 3 || @.email)].id")).containsExactly("3", "4");
            assertThat(values(doc, "$.orders[?((@.id == 1 || @.id == 2) && @.qty == 0)].id")).containsExactly("2");
        }

        @Test
        @DisplayName("Filters apply to object member values as well as array elements")
        void filterOverObject() throws Exception {
            JsonNode doc = json("{\"users\":{\"ann\":{\"age\":30},\"bob\":{\"age\":12},\"cid\":{\"age\":18}}}");

            List<String> names = resolver.resolve(doc, "$.users[?(@.age >= 18)]").stream()
                    .map(Slot::describe)
                    .collect(Collectors.toList());

            assertThat(names).containsExactly("['ann']", "['cid']");
        }

        @Test
        @DisplayName("An element whose field overflowed to infinity is excluded, not an error")
        void overflowedFieldExcluded() throws Exception {
            JsonNode doc = json("{\"x\":[{\"id\":1,\"v\":1e400},{\"id\":2,\"v\":3},{\"id\":3,\"v\":-1e400}]}");

            assertThat(values(doc, "$.x[?(@.v > 0)].id")).containsExactly("2");
            assertThat(values(doc, "$.x[?(@.v != 3)].id")).isEmpty();
            assertThat(values(doc, "$.x[?(@.v)].id")).containsExactly("1", "2", "3");
        }

        @Test
        @DisplayName("A missing field makes the test false without creating it")
        void missingField() throws Exception {
            JsonNode doc = json(orders);
            JsonNode before = doc.deepCopy();

            assertThat(values(doc, "$.orders[?(@.priority == 'high')]")).isEmpty();
            assertThat(doc).isEqualTo(before);
        }

        @Test
        @DisplayName("Filters combine with recursive descent")
        void recursiveFilter() throws Exception {
            JsonNode doc = json("{\"a\":[{\"t\":\"x\",\"v\":1}],\"b\":{\"c\":[{\"t\":\"x\",\"v\":2},{\"t\":\"y\",\"v\":3}]}}");

            assertThat(values(doc, "$..[?(@.t == 'x')].v")).containsExactly("1", "2");
        }
    }

    @Nested
    @DisplayName("Slots")
    class Slots {

        @Test
        @DisplayName("Writing through a slot mutates the owning container in place")
        void writeThrough() throws Exception {
            JsonNode doc = json("{\"a\":{\"b\":1},\"list\":[1,2]}");

            resolver.resolve(doc, "$.a.b").get(0).set(TextNode.valueOf("x"));
            resolver.resolve(doc, "$.list[1]").get(0).set(IntNode.valueOf(9));

            assertThat(doc.toString()).isEqualTo("{\"a\":{\"b\":\"x\"},\"list\":[1,9]}");
        }

        @Test
        @DisplayName("An element slot never grows its array")
        void elementSlotDoesNotGrow() throws Exception {
            JsonNode doc = json("[1,2,3]");
            Slot last = resolver.resolve(doc, "$[2]").get(0);

            ((com.fasterxml.jackson.databind.node.ArrayNode) doc).remove(2);
            last.set(IntNode.valueOf(7));

            assertThat(last.get().isMissingNode()).isTrue();
            assertThat(doc.toString()).isEqualTo("[1,2]");
        }

        @Test
        @DisplayName("Writing the root slot replaces the document held by the root")
        void rootSlot() throws Exception {
            DocumentRoot root = new DocumentRoot(json("{\"a\":1}"));
            Slot slot = resolver.resolve(root, PathExpression.parse("$")).get(0);

            slot.set(TextNode.valueOf("replaced"));

            assertThat(root.get().textValue()).isEqualTo("replaced");
        }

        @Test
        @DisplayName("Slots are equal when they address the same container and key")
        void slotIdentity() throws Exception {
            JsonNode doc = json("{\"a\":{\"x\":1},\"b\":{\"x\":1}}");
            Slot first = resolver.resolve(doc, "$.a.x").get(0);

            assertThat(first).isEqualTo(resolver.resolve(doc, "$['a'].x").get(0));
            assertThat(first).isNotEqualTo(resolver.resolve(doc, "$.b.x").get(0));
        }
    }
}
