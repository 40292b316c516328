package io.lacuna.kleene;

import io.lacuna.bifurcan.IList;
import io.lacuna.kleene.regex.Regex;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Random;

public class RoundTripTest {

  @Test
  void testRandomAutomata() {
    Converter<Character, Regex<Character>> converter = Converter.create();
    IList<String> inputs = Sequences.upTo("ab", 5);

    for (int size = 1; size <= 4; size++) {
      for (int seed = 0; seed < 50; seed++) {
        Nfa<Character> nfa = RandomAutomata.nfa(new Random(seed * 31L + size), size, "ab", 0.35);
        Regex<Character> regex = converter.toRegex(nfa, Sequences.of("ab"));

        for (String s : inputs) {
          IList<Character> input = Sequences.of(s);
          Assertions.assertEquals(nfa.accepts(input), regex.matches(input), nfa + " on '" + s + "'");
        }
      }
    }
  }

  @Test
  void testLargerAlphabet() {
    Converter<Character, Regex<Character>> converter = Converter.create();
    IList<String> inputs = Sequences.upTo("abc", 4);

    for (int seed = 0; seed < 20; seed++) {
      Nfa<Character> nfa = RandomAutomata.nfa(new Random(seed), 3, "abc", 0.25);
      Regex<Character> regex = converter.toRegex(nfa, Sequences.of("abc"));

      for (String s : inputs) {
        IList<Character> input = Sequences.of(s);
        Assertions.assertEquals(nfa.accepts(input), regex.matches(input), nfa + " on '" + s + "'");
      }
    }
  }
}
