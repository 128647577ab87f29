package io.cronwindow;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronwindow.ast.CronPattern;
import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.TestFactory;

/** Conformance tests loaded from conformance/windows.json. */
public class ConformanceTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static JsonNode FIXTURES;

  @BeforeAll
  static void loadFixtures() throws IOException {
    try (InputStream in = ConformanceTest.class.getResourceAsStream("/conformance/windows.json")) {
      assertNotNull(in, "conformance/windows.json missing from test classpath");
      FIXTURES = MAPPER.readTree(in);
    }
  }

  // Window tests

  @TestFactory
  Stream<DynamicTest> windowTests() {
    List<DynamicTest> tests = new ArrayList<>();
    JsonNode schedules = FIXTURES.get("schedules");

    for (JsonNode tc : FIXTURES.get("windows")) {
      String name = tc.get("name").asText();
      String text = schedules.get(tc.get("schedule").asText()).asText();
      boolean multi = tc.get("mode").asText().equals("multi");
      LocalDateTime start = LocalDateTime.parse(tc.get("start").asText());
      LocalDateTime end = tc.has("end") ? LocalDateTime.parse(tc.get("end").asText()) : null;

      tests.add(
          DynamicTest.dynamicTest(
              name,
              () -> {
                Schedule s = Schedule.parse(text);
                JsonNode expected = tc.get("expected");

                if (tc.has("error")) {
                  Iterator<? extends TimeWindow<?>> it =
                      multi
                          ? s.multiWindows(start, end).iterator()
                          : s.windows(start, end).iterator();
                  for (JsonNode window : expected) {
                    assertTrue(it.hasNext(), "expected a window before the error");
                    assertWindow(window, it.next(), multi);
                  }
                  UncheckedCronWindowException e =
                      assertThrows(UncheckedCronWindowException.class, it::hasNext);
                  JsonNode error = tc.get("error");
                  assertEquals(error.get("kind").asText(), e.getCause().kind().value());
                  assertEquals(
                      Optional.of(LocalDateTime.parse(error.get("minute").asText())),
                      e.getCause().minute());
                  assertEquals(
                      MAPPER.convertValue(error.get("labels"), new TypeReference<List<String>>() {}),
                      e.getCause().labels());
                  return;
                }

                Stream<? extends TimeWindow<?>> stream =
                    multi ? s.multiWindows(start, end) : s.windows(start, end);
                if (tc.has("limit")) {
                  stream = stream.limit(tc.get("limit").asInt());
                }
                List<? extends TimeWindow<?>> actual = stream.toList();

                assertEquals(expected.size(), actual.size(), "window count mismatch");
                for (int i = 0; i < expected.size(); i++) {
                  assertWindow(expected.get(i), actual.get(i), multi);
                }
              }));
    }
    return tests.stream();
  }

  // Fast lookup tests

  @TestFactory
  Stream<DynamicTest> nextMatchTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : FIXTURES.get("next_match")) {
      String name = tc.get("name").asText();
      String pattern = tc.get("pattern").asText();
      LocalDateTime after = LocalDateTime.parse(tc.get("after").asText());
      JsonNode nextNode = tc.get("next");

      tests.add(
          DynamicTest.dynamicTest(
              name,
              () -> {
                Optional<LocalDateTime> result = CronPattern.parse(pattern).nextMatchAfter(after);
                if (nextNode.isNull()) {
                  assertTrue(result.isEmpty(), "expected no match for " + pattern);
                } else {
                  assertEquals(Optional.of(LocalDateTime.parse(nextNode.asText())), result);
                }
              }));
    }
    return tests.stream();
  }

  // Parse error tests

  @TestFactory
  Stream<DynamicTest> parseErrorTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : FIXTURES.get("parse_errors")) {
      String name = tc.get("name").asText();
      String input = tc.get("input").asText();

      tests.add(
          DynamicTest.dynamicTest(
              name,
              () -> {
                CronWindowException e =
                    assertThrows(
                        CronWindowException.class,
                        () -> Schedule.parse(input),
                        "expected parse error for: " + input);
                assertEquals(ErrorKind.PARSE, e.kind());
                assertEquals(tc.get("line").asInt(), e.lineNumber());
                JsonNode span = tc.get("span");
                assertEquals(
                    Optional.of(new Span(span.get(0).asInt(), span.get(1).asInt())), e.span());
                assertFalse(Schedule.validate(input));
              }));
    }
    return tests.stream();
  }

  private static void assertWindow(JsonNode expected, TimeWindow<?> actual, boolean multi) {
    assertEquals(LocalDateTime.parse(expected.get(0).asText()), actual.start(), "start");
    assertEquals(LocalDateTime.parse(expected.get(1).asText()), actual.end(), "end");

    JsonNode label = expected.get(2);
    if (multi) {
      List<String> labels = MAPPER.convertValue(label, new TypeReference<List<String>>() {});
      assertEquals(labels, actual.label(), "labels of " + actual);
    } else if (label.isNull()) {
      assertEquals(Optional.empty(), actual.label(), "label of " + actual);
    } else {
      assertEquals(Optional.of(label.asText()), actual.label(), "label of " + actual);
    }
  }
}
