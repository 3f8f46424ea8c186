package DFAMin.Validation;

import DFAMin.Model.DFAModel;
import DFAMin.Model.StateId;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

public class DFAValidatorTest {
  private static DFAModel.Builder twoStates() {
    return DFAModel.builder()
        .alphabet("a", "b")
        .states("S", "A")
        .initial("S")
        .accepting("A");
  }

  @Test
  void testValidComplete() {
    DFAModel dfa = twoStates()
        .transition("S", "a", "A").transition("S", "b", "S")
        .transition("A", "a", "A").transition("A", "b", "S")
        .build();
    ValidationResult result = DFAValidator.validate(dfa);
    Assertions.assertTrue(result.valid());
    Assertions.assertTrue(result.diagnostics().isEmpty());
    Assertions.assertEquals(Set.of(StateId.of("S"), StateId.of("A")), result.reachableStates().orElseThrow());
  }

  @Test
  void testIncomplete() {
    DFAModel dfa = twoStates().transition("S", "a", "A").build();
    ValidationResult result = DFAValidator.validate(dfa);
    Assertions.assertFalse(result.valid());
    Assertions.assertTrue(result.has(DiagnosticKind.INCOMPLETE));
    // (S,b), (A,a) and (A,b) are missing
    Assertions.assertEquals(3, result.errors().size());
    for (Diagnostic d : result.errors()) {
      Assertions.assertEquals(DiagnosticKind.INCOMPLETE, d.kind());
      Assertions.assertTrue(d.message().contains("DFA not complete/deterministic"), d.message());
    }
    Assertions.assertTrue(result.errors().get(0).toString().startsWith("ERROR: "));
  }

  @Test
  void testUnreachableIsOnlyAWarning() {
    DFAModel dfa = DFAModel.builder()
        .alphabet("a")
        .states("A", "B", "C")
        .initial("A")
        .accepting("B")
        .transition("A", "a", "B")
        .transition("B", "a", "B")
        .transition("C", "a", "A")
        .build();
    ValidationResult result = DFAValidator.validate(dfa);
    Assertions.assertTrue(result.valid());
    Assertions.assertTrue(result.errors().isEmpty());
    Assertions.assertEquals(1, result.warnings().size());
    Diagnostic warning = result.warnings().get(0);
    Assertions.assertEquals(DiagnosticKind.UNREACHABLE_STATE, warning.kind());
    Assertions.assertEquals(Severity.WARNING, warning.severity());
    Assertions.assertEquals("State 'C' is unreachable from 'A'.", warning.message());
    Assertions.assertEquals(Set.of(StateId.of("A"), StateId.of("B")), result.reachable());
  }

  @Test
  void testEmptyAutomaton() {
    List<DFAModel> empties = List.of(
        DFAModel.builder().alphabet("a").initial("A").build(),
        DFAModel.builder().states("A").initial("A").build(),
        DFAModel.builder().alphabet("a").states("A").build());
    for (DFAModel dfa : empties) {
      ValidationResult result = DFAValidator.validate(dfa);
      Assertions.assertFalse(result.valid());
      Assertions.assertEquals(1, result.diagnostics().size());
      Assertions.assertEquals(DiagnosticKind.EMPTY_AUTOMATON, result.diagnostics().get(0).kind());
      Assertions.assertTrue(result.reachableStates().isEmpty());
    }
  }

  @Test
  void testUndeclaredInitial() {
    DFAModel dfa = DFAModel.builder()
        .alphabet("a")
        .states("A")
        .initial("Z")
        .transition("A", "a", "A")
        .build();
    ValidationResult result = DFAValidator.validate(dfa);
    Assertions.assertFalse(result.valid());
    Assertions.assertTrue(result.has(DiagnosticKind.STRUCTURAL));
    Assertions.assertTrue(result.errors().get(0).message().contains("'Z'"));
    // no reachability analysis without a declared initial state
    Assertions.assertNull(result.reachable());
    Assertions.assertFalse(result.has(DiagnosticKind.UNREACHABLE_STATE));
  }

  @Test
  void testStructuralErrors() {
    DFAModel dfa = DFAModel.builder()
        .alphabet("a")
        .states("A", "B")
        .initial("A")
        .accepting("B", "X")
        .transition("A", "a", "B")
        .transition("B", "a", "Ghost")
        .transition("Y", "a", "A")
        .transition("Y", "z", "A")
        .build();
    ValidationResult result = DFAValidator.validate(dfa);
    Assertions.assertFalse(result.valid());

    List<Diagnostic> structural = result.diagnostics().stream()
        .filter(d -> d.kind() == DiagnosticKind.STRUCTURAL).toList();
    // accepting X; destination Ghost; source Y (once); symbol z
    Assertions.assertEquals(4, structural.size(), structural.toString());
    Assertions.assertTrue(structural.stream().anyMatch(d -> d.message().contains("{X}")));
    Assertions.assertTrue(structural.stream().anyMatch(d -> d.message().contains("'Ghost'")));
    Assertions.assertTrue(structural.stream().anyMatch(d -> d.message().contains("'z'")));
    Assertions.assertEquals(1, structural.stream().filter(d -> d.message().startsWith("Transition source 'Y'")).count());
    Assertions.assertFalse(result.has(DiagnosticKind.INCOMPLETE));
  }

  @Test
  void testReachableSetIsReadOnlyCopy() {
    DFAModel dfa = DFAModel.builder().alphabet("a").states("q").initial("q").transition("q", "a", "q").build();
    ValidationResult result = DFAValidator.validate(dfa);
    Assertions.assertThrows(UnsupportedOperationException.class, () -> result.reachable().add(StateId.of("zzz")));
    Assertions.assertEquals(Set.of(StateId.of("q")), result.reachable());

    SortedSet<StateId> source = new TreeSet<>(List.of(StateId.of("q")));
    ValidationResult built = new ValidationResult(true, List.of(), source);
    source.add(StateId.of("zzz"));
    Assertions.assertEquals(Set.of(StateId.of("q")), built.reachable());
    Assertions.assertNull(new ValidationResult(false, List.of(), null).reachable());
  }

  @Test
  void testValidationDoesNotModify() {
    DFAModel dfa = twoStates().transition("S", "a", "A").build();
    DFAModel copy = twoStates().transition("S", "a", "A").build();
    DFAValidator.validate(dfa);
    Assertions.assertEquals(copy, dfa);
  }
}
