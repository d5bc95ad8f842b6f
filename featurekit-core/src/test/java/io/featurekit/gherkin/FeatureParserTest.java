package io.featurekit.gherkin;

import io.featurekit.common.Resource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeatureParserTest {

    static final Logger logger = LoggerFactory.getLogger(FeatureParserTest.class);

    @TempDir
    Path tempDir;

    private String write(String text) throws IOException {
        Path file = tempDir.resolve("test.feature");
        Files.writeString(file, text);
        return file.toString();
    }

    private Feature parseFile(String text) throws IOException {
        FeatureParser parser = new FeatureParser(write(text), 1, 1);
        parser.parse();
        return parser.getFeature();
    }

    @Test
    void testLanguageLoading() {
        FeatureParser en = new FeatureParser("/", 1, 1, "en");
        assertEquals("Feature", en.getKeywords().getFeature());
        assertEquals("Scenario", en.getKeywords().getScenario());
        assertEquals("Scenario Outline", en.getKeywords().getScenarioOutline());
        assertEquals("Examples", en.getKeywords().getExamples());
        FeatureParser de = new FeatureParser("/", 1, 1, "de");
        assertEquals("Szenario", de.getKeywords().getScenario());
        assertEquals("Szenario Auslagerung", de.getKeywords().getScenarioOutline());
        assertEquals("Beispiele", de.getKeywords().getExamples());
        UnsupportedLanguageException e = assertThrows(UnsupportedLanguageException.class,
                () -> new FeatureParser("/", 1, 1, "foo"));
        assertEquals("foo", e.getLanguage());
    }

    @Test
    void testNonExistingFile() {
        FeatureNotFoundException e = assertThrows(FeatureNotFoundException.class,
                () -> new FeatureParser("nonexisting.feature", 1, 1));
        assertTrue(e.getMessage().startsWith("Feature file at 'nonexisting.feature' does not exist"));
        assertEquals("nonexisting.feature", e.getPath());
    }

    @Test
    void testDirectoryCannotBeRead() {
        FeatureParser parser = new FeatureParser(tempDir.toString(), 1, 1);
        FeatureNotFoundException e = assertThrows(FeatureNotFoundException.class, parser::parse);
        assertTrue(e.getMessage().contains("could not be read"));
        assertNotNull(e.getCause());
    }

    @Test
    void testEmptyFile() throws IOException {
        String path = write("");
        FeatureParser parser = new FeatureParser(path, 1, 1);
        EmptyDocumentException e = assertThrows(EmptyDocumentException.class, parser::parse);
        assertTrue(e.getMessage().startsWith("No Feature found in file " + path));
        assertNull(parser.getFeature());
    }

    @Test
    void testCommentsOnlyIsEmpty() {
        assertThrows(EmptyDocumentException.class, () -> FeatureParser.text("# nothing here\n\n").parse());
    }

    @Test
    void testEmptyFeature() throws IOException {
        Feature feature = parseFile("Feature: some empty feature");
        assertEquals("some empty feature", feature.getSentence());
        assertEquals(1, feature.getId());
        assertEquals(tempDir.resolve("test.feature").toString(), feature.getPath());
        assertEquals(1, feature.getLine());
        assertTrue(feature.getScenarios().isEmpty());
        assertTrue(feature.getRules().isEmpty());
        assertFalse(feature.isBackgroundPresent());
        assertEquals("en", feature.getLanguage());
    }

    @Test
    void testEmptyFeatureWithDescription() throws IOException {
        Feature feature = parseFile("""
                Feature: some empty feature
                    In order to support cool software
                    I do fancy BDD testing""");
        assertEquals("some empty feature", feature.getSentence());
        assertTrue(feature.getScenarios().isEmpty());
        assertEquals(List.of("In order to support cool software", "I do fancy BDD testing"), feature.getDescription());
    }

    @Test
    void testMultipleFeatures() throws IOException {
        FeatureParser parser = new FeatureParser(write("""
                Feature: some empty feature
                Feature: another empty feature"""), 1, 1);
        MultipleFeatureException e = assertThrows(MultipleFeatureException.class, parser::parse);
        assertTrue(e.getMessage().startsWith("only one Feature per feature file is supported"));
        assertEquals(2, e.getLine());
    }

    @Test
    void testEmptyScenario() throws IOException {
        Feature feature = parseFile("""
                Feature: some feature
                    Scenario: some empty scenario""");
        assertEquals(1, feature.getScenarios().size());
        Scenario scenario = feature.getScenarios().get(0);
        assertEquals(1, scenario.getId());
        assertEquals("some empty scenario", scenario.getSentence());
        assertEquals(feature.getPath(), scenario.getPath());
        assertEquals(2, scenario.getLine());
        assertTrue(scenario.getSteps().isEmpty());
        assertEquals(ScenarioKind.SCENARIO, scenario.getKind());
    }

    @Test
    void testScenarioWithSteps() throws IOException {
        Feature feature = parseFile("""
                Feature: some feature
                    Scenario: some fancy scenario
                        Given I have the number 5
                        When I add 2 to my number
                        Then I expect my number to be 7\s""");
        List<Step> steps = feature.getScenarios().get(0).getSteps();
        assertEquals(3, steps.size());
        assertStep(steps.get(0), 1, "Given I have the number 5", 3);
        assertStep(steps.get(1), 2, "When I add 2 to my number", 4);
        assertStep(steps.get(2), 3, "Then I expect my number to be 7", 5);
        assertEquals(feature.getPath(), steps.get(0).getPath());
        assertEquals("Given", steps.get(0).getKeyword());
        assertEquals("I have the number 5", steps.get(0).getText());
    }

    private static void assertStep(Step step, int id, String sentence, int line) {
        assertEquals(id, step.getId());
        assertEquals(sentence, step.getSentence());
        assertEquals(line, step.getLine());
    }

    @Test
    void testMultipleScenarios() throws IOException {
        Feature feature = parseFile("""
                Feature: some feature
                    Scenario: some fancy scenario
                        Given I have the number 5
                        When I add 2 to my number
                        Then I expect my number to be 7

                    Scenario: some other fancy scenario
                        Given I have the number 50
                        When I add 20 to my number
                        Then I expect my number to be 70""");
        assertEquals(2, feature.getScenarios().size());
        Scenario second = feature.getScenarios().get(1);
        assertEquals(2, second.getId());
        assertEquals("some other fancy scenario", second.getSentence());
        assertStep(second.getSteps().get(0), 1, "Given I have the number 50", 8);
        assertStep(second.getSteps().get(1), 2, "When I add 20 to my number", 9);
        assertStep(second.getSteps().get(2), 3, "Then I expect my number to be 70", 10);
    }

    @Test
    void testCommentsKeepLineNumbers() throws IOException {
        Feature feature = parseFile("""
                Feature: some feature
                    # this is a comment
                    Scenario: some fancy scenario
                        Given I have the number 5
                        When I add 2 to my number
                        # this is another comment
                        Then I expect my number to be 7

                    Scenario: some other fancy scenario
                        Given I have the number 50
                        # foobar comment
                        When I add 20 to my number
                        Then I expect my number to be 70
                        # another stupid comment""");
        Scenario first = feature.getScenarios().get(0);
        Scenario second = feature.getScenarios().get(1);
        assertEquals(3, first.getLine());
        assertEquals(List.of(4, 5, 7), first.getSteps().stream().map(Step::getLine).toList());
        assertEquals(9, second.getLine());
        assertEquals(List.of(10, 12, 13), second.getSteps().stream().map(Step::getLine).toList());
    }

    @Test
    void testScenarioOutline() throws IOException {
        Feature feature = parseFile("""
                Feature: some feature
                    Scenario Outline: some fancy scenario
                        Given I have the number <number>
                        When I add <delta> to my number
                        Then I expect my number to be <result>

                    Examples:
                        | number | delta | result |
                        | 5      | 2     | 7      |
                        | 10     | 3     | 13     |
                        | 15     | 6     | 21     |
                """);
        assertEquals(1, feature.getScenarios().size());
        ScenarioOutline outline = assertInstanceOf(ScenarioOutline.class, feature.getScenarios().get(0));
        assertEquals(1, outline.getId());
        assertEquals(ScenarioKind.OUTLINE, outline.getKind());
        assertEquals("Given I have the number <number>", outline.getSteps().get(0).getSentence());
        assertEquals(List.of("number", "delta", "result"), outline.getExamplesHeader());
        assertEquals(3, outline.getExamples().size());
        assertEquals(List.of("5", "2", "7"), outline.getExamples().get(0).getData());
        assertEquals(List.of("10", "3", "13"), outline.getExamples().get(1).getData());
        assertEquals(List.of("15", "6", "21"), outline.getExamples().get(2).getData());
        assertEquals(9, outline.getExamples().get(0).getLine());
        List<Scenario> children = outline.getChildren();
        assertEquals(3, children.size());
        String[][] expected = {{"5", "2", "7"}, {"10", "3", "13"}, {"15", "6", "21"}};
        for (int i = 0; i < 3; i++) {
            Scenario child = children.get(i);
            assertEquals(i + 2, child.getId());
            assertEquals("some fancy scenario - row " + i, child.getSentence());
            assertEquals(9 + i, child.getLine());
            assertEquals(ScenarioKind.SCENARIO, child.getKind());
            List<Step> steps = child.getSteps();
            assertStep(steps.get(0), 1, "Given I have the number " + expected[i][0], 3);
            assertStep(steps.get(1), 2, "When I add " + expected[i][1] + " to my number", 4);
            assertStep(steps.get(2), 3, "Then I expect my number to be " + expected[i][2], 5);
        }
        assertEquals(children, feature.getAllScenarios());
    }

    @Test
    void testScenarioIdsAfterOutline() throws IOException {
        Feature feature = parseFile("""
                Feature: some feature
                    Scenario: some normal scenario
                        Given I do some stuff

                    Scenario Outline: some fancy scenario
                        Given I have the number <number>

                    Examples:
                        | number |
                        | 5      |
                        | 10     |
                        | 15     |

                    Scenario: some other normal scenario
                        Given I do some other stuff
                """);
        List<Scenario> scenarios = feature.getScenarios();
        assertEquals(3, scenarios.size());
        assertEquals(1, scenarios.get(0).getId());
        assertEquals(2, scenarios.get(1).getId());
        assertInstanceOf(ScenarioOutline.class, scenarios.get(1));
        assertEquals(6, scenarios.get(2).getId());
        assertEquals("some other normal scenario", scenarios.get(2).getSentence());
        assertEquals(5, feature.getAllScenarios().size());
        assertEquals("some fancy scenario - row 2", feature.findScenarioById(5).getSentence());
    }

    @Test
    void testExamplesOnPlainScenario() throws IOException {
        FeatureParser parser = new FeatureParser(write("""
                Feature: some feature
                    Scenario: some fancy scenario
                        Given I have the number <number>

                    Examples:
                        | number |
                        | 5      |
                """), 1, 1);
        UnsupportedExamplesException e = assertThrows(UnsupportedExamplesException.class, parser::parse);
        assertTrue(e.getMessage().startsWith("Scenario does not support Examples. Use 'Scenario Outline'"));
        assertEquals(5, e.getLine());
    }

    @Test
    void testExamplesOnScenarioLoop() {
        UnsupportedExamplesException e = assertThrows(UnsupportedExamplesException.class, () -> FeatureParser.text("""
                Feature: some feature
                    Scenario Loop 2: some loop
                        Given a step
                    Examples:
                        | a |
                """).parse());
        assertTrue(e.getMessage().startsWith("Scenario Loop does not support Examples"));
    }

    @Test
    void testStepWithTable() throws IOException {
        Feature feature = parseFile("""
                Feature: some feature
                    Scenario: some normal scenario
                        Given I have the user
                            | Bruce     | Wayne      | Batman      |
                            | Chuck     | Norris     | PureAwesome |
                            | Peter     | Parker     | Spiderman   |
                        When I register them in the database
                        Then I expect 3 entries in the database
                """);
        List<Step> steps = feature.getScenarios().get(0).getSteps();
        assertEquals(3, steps.size());
        DataTable table = steps.get(0).getTable();
        assertEquals(3, table.size());
        assertEquals(List.of("Bruce", "Wayne", "Batman"), table.getRow(0));
        assertEquals(List.of("Chuck", "Norris", "PureAwesome"), table.getRow(1));
        assertEquals(List.of("Peter", "Parker", "Spiderman"), table.getRow(2));
        assertEquals(List.of(4, 5, 6), table.getLineNumbers());
        assertFalse(steps.get(1).hasTable());
        assertNull(steps.get(2).getTable());
        assertEquals("When I register them in the database", steps.get(1).getSentence());
    }

    @Test
    void testTableEscapedPipe() {
        Feature feature = FeatureParser.text("""
                Feature: f
                  Scenario: s
                    Given values
                      | a\\|b | c\\\\ |  |
                """).parse();
        assertEquals(List.of("a|b", "c\\", ""), feature.getScenarios().get(0).getSteps().get(0).getTable().getRow(0));
    }

    @Test
    void testDetectScenarioLoop() {
        FeatureParser parser = FeatureParser.text("Feature: f").build();
        ScenarioLoopHeader header = parser.detectScenarioLoop("Scenario Loop 10: Some fancy scenario loop");
        assertEquals("Some fancy scenario loop", header.sentence());
        assertEquals(10, header.iterations());
        assertNull(parser.detectScenarioLoop(""));
        assertNull(parser.detectScenarioLoop("Scenario: Some fancy scenario"));
        assertNull(parser.detectScenarioLoop("Scenario Outline: Some fancy scenario"));
        assertNull(parser.detectScenarioLoop("Scenario Loop: Some fancy scenario"));
        assertNull(parser.detectScenarioLoop("Scenario Loop 5.5: Some fancy scenario"));
    }

    @Test
    void testScenarioLoop() throws IOException {
        Feature feature = parseFile("""
                Feature: some feature
                    Scenario Loop 10: some fancy scenario
                        Given I have the number 1
                        When I add 2 to my number
                        Then I expect my number to be 3
                """);
        assertEquals(1, feature.getScenarios().size());
        ScenarioLoop loop = assertInstanceOf(ScenarioLoop.class, feature.getScenarios().get(0));
        assertEquals(1, loop.getId());
        assertEquals("some fancy scenario", loop.getSentence());
        assertEquals(10, loop.getIterations());
        assertStep(loop.getSteps().get(0), 1, "Given I have the number 1", 3);
        assertStep(loop.getSteps().get(2), 3, "Then I expect my number to be 3", 5);
        assertEquals(10, loop.getChildren().size());
        for (int i = 0; i < 10; i++) {
            Scenario child = loop.getChildren().get(i);
            assertEquals(i + 2, child.getId());
            assertEquals("some fancy scenario - iteration " + i, child.getSentence());
            assertEquals(2, child.getLine());
            assertEquals(3, child.getSteps().size());
            assertStep(child.getSteps().get(0), 1, "Given I have the number 1", 3);
            assertStep(child.getSteps().get(1), 2, "When I add 2 to my number", 4);
            assertStep(child.getSteps().get(2), 3, "Then I expect my number to be 3", 5);
        }
    }

    @Test
    void testScenarioLoopZeroIsNotALoop() {
        assertThrows(MalformedStructureException.class, () -> FeatureParser.text("""
                Feature: f
                    Scenario: first
                    Scenario Loop 0: never
                """).parse());
    }

    @Test
    void testTagsAndIds() {
        Feature feature = FeatureParser.text("""
                @smoke @fast
                Feature: tagged
                  @wip
                  Scenario Outline: template
                    Given <x>
                  Examples:
                    | x |
                    | 1 |
                """).featureId(7).tagId(100).scenarioId(20).parse();
        assertEquals(7, feature.getId());
        assertEquals(List.of(new Tag("smoke"), new Tag("fast")), feature.getTags());
        assertEquals(100, feature.getTags().get(0).getId());
        assertEquals(101, feature.getTags().get(1).getId());
        assertEquals(1, feature.getTags().get(0).getLine());
        Scenario outline = feature.getScenarios().get(0);
        assertEquals(20, outline.getId());
        assertEquals(102, outline.getTags().get(0).getId());
        Scenario child = outline.getChildren().get(0);
        assertEquals(21, child.getId());
        assertTrue(child.hasTag("wip"));
        assertEquals("Given 1", child.getSteps().get(0).getSentence());
    }

    @Test
    void testTagLineWithComment() {
        Feature feature = FeatureParser.text("""
                @one @two # trailing comment
                Feature: f
                """).parse();
        assertEquals(2, feature.getTags().size());
    }

    @Test
    void testBackground() {
        Feature feature = FeatureParser.text("""
                Feature: f
                  Background: setup
                    Given a clean database
                    And a user
                  Scenario: s
                    When something happens
                """).parse();
        assertTrue(feature.isBackgroundPresent());
        Background background = feature.getBackground();
        assertEquals("setup", background.getShortDescription());
        assertEquals(2, background.getLine());
        assertEquals(2, background.getSteps().size());
        assertEquals("And a user", background.getSteps().get(1).getSentence());
        assertEquals(1, feature.getScenarios().size());
        assertSame(background.getSteps().get(0), feature.findStepByLine(3));
        assertEquals("When something happens", feature.findStepByLine(6).getSentence());
    }

    @Test
    void testBackgroundWithoutShortDescription() {
        Feature feature = FeatureParser.text("""
                Feature: f
                  Background:
                """).parse();
        assertNull(feature.getBackground().getShortDescription());
        assertTrue(feature.getBackground().getSteps().isEmpty());
    }

    @Test
    void testBackgroundAfterScenarioFails() {
        MalformedStructureException e = assertThrows(MalformedStructureException.class, () -> FeatureParser.text("""
                Feature: f
                  Scenario: s
                    Given x
                  Background:
                """).parse());
        assertEquals(4, e.getLine());
    }

    @Test
    void testSecondBackgroundFails() {
        assertThrows(MalformedStructureException.class, () -> FeatureParser.text("""
                Feature: f
                  Background:
                    Given x
                  Background:
                    Given y
                """).parse());
    }

    @Test
    void testRules() {
        Feature feature = FeatureParser.text("""
                Feature: f
                  Scenario: outside
                    Given a

                  @ruled
                  Rule: first rule
                    Scenario: one
                      Given b
                    Scenario: two
                      Given c

                  Rule: second rule
                    Scenario: three
                      Given d
                """).parse();
        List<Rule> rules = feature.getRules();
        assertEquals(3, rules.size());
        assertTrue(rules.get(0).isDefault());
        assertEquals(List.of("outside"), rules.get(0).getScenarios().stream().map(Scenario::getSentence).toList());
        assertEquals("first rule", rules.get(1).getShortDescription());
        assertEquals(6, rules.get(1).getLine());
        assertEquals("ruled", rules.get(1).getTags().get(0).getName());
        assertEquals(2, rules.get(1).getScenarios().size());
        assertEquals("second rule", rules.get(2).getShortDescription());
        assertEquals(List.of("outside", "one", "two", "three"),
                feature.getScenarios().stream().map(Scenario::getSentence).toList());
        assertEquals(List.of(1, 2, 3, 4), feature.getScenarios().stream().map(Scenario::getId).toList());
    }

    @Test
    void testOnlyNamedRules() {
        Feature feature = FeatureParser.text("""
                Feature: f
                  Rule: r
                    Scenario: s
                """).parse();
        assertEquals(1, feature.getRules().size());
        assertFalse(feature.getRules().get(0).isDefault());
    }

    @Test
    void testDocString() {
        Feature feature = FeatureParser.text("""
                Feature: f
                  Scenario: s
                    Given a document
                      \"\"\"
                      {
                        "name": "<name>"
                      }
                      # not a comment
                      \"\"\"
                    Then done
                """).parse();
        Step step = feature.getScenarios().get(0).getSteps().get(0);
        assertTrue(step.hasDocString());
        assertEquals(List.of("{", "  \"name\": \"<name>\"", "}", "# not a comment"), step.getDocString().getLines());
        assertEquals(4, step.getDocString().getLine());
        assertEquals(10, feature.getScenarios().get(0).getSteps().get(1).getLine());
    }

    @Test
    void testOutlineSubstitutesTablesAndDocStrings() {
        Feature feature = FeatureParser.text("""
                Feature: f
                  Scenario Outline: s
                    Given a user
                      | <first> | <last> | <unknown> |
                    And a document
                      \"\"\"
                      hello <first>
                      \"\"\"
                  Examples:
                    | first | last  | first |
                    | Bruce | Wayne | Other |
                """).parse();
        Scenario child = feature.getScenarios().get(0).getChildren().get(0);
        assertEquals(List.of("Bruce", "Wayne", "<unknown>"), child.getSteps().get(0).getTable().getRow(0));
        assertEquals("hello Bruce", child.getSteps().get(1).getDocString().getText());
        Scenario outline = feature.getScenarios().get(0);
        assertEquals(List.of("<first>", "<last>", "<unknown>"), outline.getSteps().get(0).getTable().getRow(0));
    }

    @Test
    void testSubstitutionIsSinglePass() {
        assertEquals("a <b> c", ScenarioOutline.substitute("a <x> c", Map.of("x", "<b>", "b", "no")));
        assertEquals("$1 and \\", ScenarioOutline.substitute("<a> and <b>", Map.of("a", "$1", "b", "\\")));
    }

    @Test
    void testMultipleExamplesBlocks() {
        Feature feature = FeatureParser.text("""
                Feature: f
                  Scenario Outline: s
                    Given <n>
                  Examples:
                    | n |
                    | 1 |
                  Examples:
                    | n |
                    | 2 |
                """).parse();
        ScenarioOutline outline = (ScenarioOutline) feature.getScenarios().get(0);
        assertEquals(2, outline.getExamples().size());
        assertEquals("Given 2", outline.getChildren().get(1).getSteps().get(0).getSentence());
    }

    @Test
    void testOutlineWithoutExamples() {
        ScenarioOutline outline = (ScenarioOutline) FeatureParser.text("""
                Feature: f
                  Scenario Outline: s
                    Given <n>
                """).parse().getScenarios().get(0);
        assertTrue(outline.getExamplesHeader().isEmpty());
        assertTrue(outline.getChildren().isEmpty());
    }

    @Test
    void testMalformedDocuments() {
        assertMalformed("some text\nFeature: f\n", 1);
        assertMalformed("Feature: f\n\n  Given orphan step\n", 3);
        assertMalformed("Feature: f\n  Scenario: s\n    Given x\n      | a \\|\n", 4);
        assertMalformed("Feature: f\n  Scenario: s\n    | a |\n", 3);
        assertMalformed("Feature: f\n  Scenario: s\n    Given x\n      | a |\n      | b\n", 5);
        assertMalformed("Feature: f\n  Scenario: s\n    Given x\n      \"\"\"\n      open\n", 4);
        assertMalformed("Feature: f\n  @dangling\n", 2);
        assertMalformed("Feature: f\n  Scenario Outline: s\n    Given <a>\n  Examples:\n    | a |\n    | 1 | 2 |\n", 6);
        assertMalformed("Feature: f\n  Scenario Outline: s\n    Given <a>\n  Examples:\n", 4);
        assertMalformed("Feature: f\n  desc\n\n  more text\n", 4);
        assertMalformed("Feature: f\n  @tag\n  Given x\n", 3);
        assertMalformed("Feature: f\n  Examples:\n", 2);
    }

    private static void assertMalformed(String text, int line) {
        MalformedStructureException e = assertThrows(MalformedStructureException.class,
                () -> FeatureParser.text(text).parse());
        logger.debug("expected failure: {}", e.getMessage());
        assertEquals(line, e.getLine());
        assertEquals(Resource.INLINE, e.getPath());
    }

    @Test
    void testGermanFeature() {
        Feature feature = FeatureParser.text("""
                # language: de
                Funktionalität: Rechner
                  Grundlage:
                    Angenommen ein Rechner
                  Szenario Auslagerung: Addition
                    Gegeben sei die Zahl <a>
                    Wenn ich <b> addiere
                    Dann ist das Ergebnis <c>
                  Beispiele:
                    | a | b | c |
                    | 1 | 2 | 3 |
                  Szenario Wiederholung 2: Wiederholt
                    Und nochmal
                """).language("de").parse();
        assertEquals("de", feature.getLanguage());
        assertEquals("Rechner", feature.getSentence());
        assertEquals("Angenommen", feature.getBackground().getSteps().get(0).getKeyword());
        Scenario outline = feature.getScenarios().get(0);
        assertEquals(ScenarioKind.OUTLINE, outline.getKind());
        Step given = outline.getChildren().get(0).getSteps().get(0);
        assertEquals("Gegeben sei", given.getKeyword());
        assertEquals("Gegeben sei die Zahl 1", given.getSentence());
        Scenario loop = feature.getScenarios().get(1);
        assertEquals(ScenarioKind.LOOP, loop.getKind());
        assertEquals(3, loop.getId());
        assertEquals(2, loop.getChildren().size());
    }

    @Test
    void testAnyStepKeyword() {
        Feature feature = FeatureParser.text("""
                Feature: f
                  Scenario: s
                    * anything goes
                    Given
                """).parse();
        List<Step> steps = feature.getScenarios().get(0).getSteps();
        assertEquals("*", steps.get(0).getKeyword());
        assertEquals("* anything goes", steps.get(0).getSentence());
        assertEquals("Given", steps.get(1).getSentence());
    }

    @Test
    void testCrLfAndBom() {
        Feature feature = FeatureParser.text("\uFEFF" + "Feature: f\r\n  Scenario: s\r\n    Given x\r\n").parse();
        assertEquals("f", feature.getSentence());
        assertEquals(3, feature.getScenarios().get(0).getSteps().get(0).getLine());
    }

    @Test
    void testFeatureRead() throws IOException {
        Path file = Path.of(write("Feature: from disk\n  Scenario: s\n"));
        Feature feature = Feature.read(file);
        assertEquals("from disk", feature.getSentence());
        assertEquals(1, feature.getScenarios().size());
    }

    @Test
    void testFeatureFile() {
        FeatureParser parser = new FeatureParser("src/test/resources/feature/calculator.feature", 1, 1);
        Feature feature = parser.parse();
        assertEquals("Calculator", feature.getSentence());
        assertEquals(2, feature.getLine());
        assertEquals(2, feature.getDescription().size());
        assertEquals("a fresh calculator", feature.getBackground().getShortDescription());
        assertEquals(2, feature.getRules().size());
        assertEquals("division", feature.getRules().get(1).getShortDescription());
        List<Scenario> scenarios = feature.getScenarios();
        assertEquals(List.of(1, 2, 5, 9), scenarios.stream().map(Scenario::getId).toList());
        assertEquals(1 + 2 + 3 + 1, feature.getAllScenarios().size());
        Scenario loop = scenarios.get(2);
        assertEquals(28, loop.getLine());
        assertEquals("press clear - iteration 2", loop.getChildren().get(2).getSentence());
        Step last = scenarios.get(3).getSteps().get(2);
        assertEquals("cannot divide by zero", last.getDocString().getText());
        assertTrue(feature.getScenarios().get(0).hasTag("smoke"));
        assertEquals("Then the result should be 30 on the screen",
                feature.findScenarioById(4).getSteps().get(3).getSentence());
    }

    @Test
    void testModelHelpers() {
        Feature feature = FeatureParser.text("""
                Feature: f
                  Scenario Outline: s
                    Given <a>
                      | x | y |
                      | z |
                  Examples:
                    | a |
                    | 1 |
                """).parse();
        Scenario outline = feature.getScenarios().get(0);
        assertEquals("Scenario Outline: s", outline.toString());
        assertEquals("(inline):2", outline.getDebugInfo());
        assertTrue(outline.isTemplate());
        Step step = outline.getStepByLine(3);
        assertEquals("(inline):3", step.getDebugInfo());
        assertEquals(2, step.getTable().getColumnCount());
        assertEquals(5, step.getTable().getLineNumber(1));
        assertNull(outline.getStepByLine(4));
        assertEquals("Scenario: s - row 0", outline.getChildren().get(0).toString());
        assertFalse(outline.getChildren().get(0).isTemplate());
        assertEquals("(default rule)", feature.getRules().get(0).toString());
    }

    @Test
    void testDescriptionWithStepWords() {
        Feature feature = FeatureParser.text("""
                Feature: opening hours
                    Given a shop
                    But only on weekdays
                    * first bullet
                    | not a table |

                  Scenario: s
                    Given x
                """).parse();
        assertEquals(List.of("Given a shop", "But only on weekdays", "* first bullet", "| not a table |"),
                feature.getDescription());
        assertEquals(1, feature.getScenarios().get(0).getSteps().size());
    }

    @Test
    void testTableRowEndingInEscapedBackslash() {
        Feature feature = FeatureParser.text("""
                Feature: f
                  Scenario: s
                    Given x
                      | a \\\\|
                """).parse();
        assertEquals(List.of("a \\"), feature.getScenarios().get(0).getSteps().get(0).getTable().getRow(0));
    }

    @Test
    void testParsersAreIndependent() {
        Feature first = FeatureParser.text("Feature: a\n  Scenario: s\n").parse();
        Feature second = FeatureParser.text("Feature: b\n  Scenario: s\n").parse();
        assertEquals(1, first.getScenarios().get(0).getId());
        assertEquals(1, second.getScenarios().get(0).getId());
    }

}
