package io.lacuna.kleene;

import io.lacuna.kleene.regex.Regex;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static io.lacuna.kleene.regex.Regex.*;

public class GeneralizedAutomatonTest {

  private static final RegexMatcher<Character, Regex<Character>> MATCHER = Regex.matcher();

  // start -ε-> q0, q0 -a-> q1, q1 -b-> q0, q1 -ε-> accept, so (ab)*a
  private static GeneralizedAutomaton<Regex<Character>> alternating() {
    return GeneralizedAutomaton.from(2, new Transitions<Regex<Character>>() {
      @Override
      public Regex<Character> startToAccept() {
        return zero();
      }

      @Override
      public Regex<Character> startTo(int target) {
        return target == 0 ? one() : zero();
      }

      @Override
      public Regex<Character> toAccept(int source) {
        return source == 1 ? one() : zero();
      }

      @Override
      public Regex<Character> between(int source, int target) {
        if (source == 0 && target == 1) {
          return literal('a');
        } else if (source == 1 && target == 0) {
          return literal('b');
        }
        return zero();
      }
    });
  }

  @Test
  void testStep() {
    GeneralizedAutomaton<Regex<Character>> g = alternating();

    Assertions.assertEquals(2, g.size());
    Assertions.assertEquals(zero(), g.step(Source.START, Target.ACCEPT));
    Assertions.assertEquals(one(), g.step(Source.START, Target.internal(0)));
    Assertions.assertEquals(zero(), g.step(Source.START, Target.internal(1)));
    Assertions.assertEquals(literal('a'), g.step(Source.internal(0), Target.internal(1)));
    Assertions.assertEquals(literal('b'), g.step(Source.internal(1), Target.internal(0)));
    Assertions.assertEquals(zero(), g.step(Source.internal(1), Target.internal(1)));
    Assertions.assertEquals(one(), g.step(Source.internal(1), Target.ACCEPT));
    Assertions.assertEquals(zero(), g.step(Source.internal(0), Target.ACCEPT));
  }

  @Test
  void testTransitionsView() {
    GeneralizedAutomaton<Regex<Character>> g = alternating();
    GeneralizedAutomaton<Regex<Character>> copy = GeneralizedAutomaton.from(g.size(), g.transitions());

    Assertions.assertEquals(g.toString(), copy.toString());
    Assertions.assertSame(g.step(Source.internal(0), Target.internal(1)), copy.step(Source.internal(0), Target.internal(1)));
  }

  @Test
  void testOutOfBounds() {
    GeneralizedAutomaton<Regex<Character>> g = alternating();

    Assertions.assertThrows(IndexOutOfBoundsException.class, () -> g.step(Source.START, Target.internal(2)));
    Assertions.assertThrows(IndexOutOfBoundsException.class, () -> g.step(Source.internal(2), Target.ACCEPT));
    Assertions.assertThrows(IndexOutOfBoundsException.class, () -> g.step(Source.internal(0), Target.internal(5)));
    Assertions.assertThrows(IllegalArgumentException.class, () -> Source.internal(-1));
    Assertions.assertThrows(IllegalArgumentException.class, () -> Target.internal(-1));
  }

  @Test
  void testInvalidConstruction() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> GeneralizedAutomaton.from(-1, alternating().transitions()));
    Assertions.assertThrows(NullPointerException.class, () -> GeneralizedAutomaton.from(0, new Transitions<Regex<Character>>() {
      @Override
      public Regex<Character> startToAccept() {
        return null;
      }

      @Override
      public Regex<Character> startTo(int target) {
        return zero();
      }

      @Override
      public Regex<Character> toAccept(int source) {
        return zero();
      }

      @Override
      public Regex<Character> between(int source, int target) {
        return zero();
      }
    }));
  }

  @Test
  void testSingle() {
    Regex<Character> r = star(literal('a'));
    GeneralizedAutomaton<Regex<Character>> g = GeneralizedAutomaton.of(r);

    Assertions.assertEquals(0, g.size());
    Assertions.assertSame(r, g.single());
    Assertions.assertSame(r, g.step(Source.START, Target.ACCEPT));
    Assertions.assertThrows(IllegalStateException.class, () -> alternating().single());
  }

  @Test
  void testAccepts() {
    GeneralizedAutomaton<Regex<Character>> g = alternating();
    for (String s : Sequences.upTo("ab", 6)) {
      Assertions.assertEquals(s.matches("(ab)*a"), g.accepts(Sequences.of(s), MATCHER), s);
    }
  }

  @Test
  void testAcceptsWithEmptyCycles() {
    // q0 and q1 loop into each other on ε, which must not stop the search from reaching the accept state
    GeneralizedAutomaton<Regex<Character>> g = GeneralizedAutomaton.from(2, new Transitions<Regex<Character>>() {
      @Override
      public Regex<Character> startToAccept() {
        return zero();
      }

      @Override
      public Regex<Character> startTo(int target) {
        return target == 0 ? one() : zero();
      }

      @Override
      public Regex<Character> toAccept(int source) {
        return source == 1 ? literal('b') : zero();
      }

      @Override
      public Regex<Character> between(int source, int target) {
        return source == target ? star(literal('a')) : one();
      }
    });

    for (String s : Sequences.upTo("ab", 5)) {
      Assertions.assertEquals(s.matches("a*b"), g.accepts(Sequences.of(s), MATCHER), s);
    }
  }
}
