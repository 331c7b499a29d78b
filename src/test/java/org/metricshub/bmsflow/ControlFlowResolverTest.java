package org.metricshub.bmsflow;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.metricshub.bmsflow.BmsTestSupport.chart;
import static org.metricshub.bmsflow.BmsTestSupport.flowTest;
import static org.metricshub.bmsflow.BmsTestSupport.kinds;
import static org.metricshub.bmsflow.BmsTestSupport.texts;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.bmsflow.backend.ControlFlowResolver;
import org.metricshub.bmsflow.backend.Diagnostic;
import org.metricshub.bmsflow.backend.Resolution;
import org.metricshub.bmsflow.backend.WarningKind;
import org.metricshub.bmsflow.frontend.BmsLexer;
import org.metricshub.bmsflow.frontend.SourcePosition;
import org.metricshub.bmsflow.frontend.Token;
import org.metricshub.bmsflow.jrt.BsdRandomSource;
import org.metricshub.bmsflow.jrt.FixedRandomSource;
import org.metricshub.bmsflow.jrt.RandomSource;

/**
 * Single-pass resolution of charts with {@link ControlFlowResolver}.
 */
public class ControlFlowResolverTest {

	private static final String[] IF_CHAIN = {
			"#RANDOM 3",
			"#IF 1",
			"A",
			"#ELSEIF 2",
			"B",
			"#ELSE",
			"C",
			"#ENDIF",
			"#ENDRANDOM" };

	private static final String[] NESTED = {
			"#RANDOM 2",
			"#IF 1",
			"A",
			"#RANDOM 2",
			"#IF 2",
			"B",
			"#ENDIF",
			"#ENDRANDOM",
			"#ENDIF",
			"#ENDRANDOM" };

	private static Resolution resolve(String text, RandomSource source) throws Exception {
		List<Token> tokens = new BmsLexer().tokenize(text);
		return new ControlFlowResolver(source).resolve(tokens);
	}

	@Test
	public void onlyTheMatchingBranchIsKept() throws Exception {
		flowTest("value 1").chart(IF_CHAIN).values(1).expectLines("A").runAndAssert();
		flowTest("value 2").chart(IF_CHAIN).values(2).expectLines("B").runAndAssert();
		flowTest("value 3 selects #ELSE").chart(IF_CHAIN).values(3).expectLines("C").runAndAssert();
	}

	@Test
	public void noBranchIsKeptWithoutMatchOrElse() throws Exception {
		flowTest("no else")
				.chart("#RANDOM 3", "#IF 1", "A", "#ENDIF", "#IF 2", "B", "#ENDIF", "#ENDRANDOM", "Z")
				.values(3)
				.expectLines("Z")
				.runAndAssert();
	}

	@Test
	public void everyChainOfAScopeComparesWithTheSameValue() throws Exception {
		flowTest("two chains")
				.chart("#RANDOM 2", "#IF 1", "A", "#ENDIF", "#IF 1", "B", "#ELSE", "C", "#ENDIF", "#ENDRANDOM")
				.values(1)
				.expectLines("A", "B")
				.runAndAssert();
	}

	@Test
	public void outOfRangeBranchesAreNeverKept() throws Exception {
		flowTest("out of range conditions")
				.chart("#RANDOM 2", "#IF 3", "X", "#ENDIF", "#IF 0", "Y", "#ENDIF", "#IF 1", "A", "#ENDIF", "#ENDRANDOM")
				.values(1)
				.expectLines("A")
				.expectDiagnostics(
						WarningKind.RANDOM_IF_BRANCH_VALUE_OUT_OF_RANGE,
						WarningKind.RANDOM_IF_BRANCH_VALUE_OUT_OF_RANGE)
				.runAndAssert();
	}

	@Test
	public void outOfRangeBranchIsNotKeptEvenWhenTheSourceReturnsItsValue() throws Exception {
		flowTest("source out of range")
				.chart("#RANDOM 2", "#IF 3", "X", "#ENDIF", "#ENDRANDOM")
				.values(3)
				.expectLines()
				.expectDiagnostics(
						WarningKind.RANDOM_VALUE_OUT_OF_RANGE,
						WarningKind.RANDOM_IF_BRANCH_VALUE_OUT_OF_RANGE)
				.runAndAssert();
	}

	@Test
	public void outOfRangeCaseIsRejected() throws Exception {
		flowTest("case out of range")
				.chart("#SWITCH 2", "#CASE 5", "X", "#SKIP", "#DEF", "D", "#SKIP", "#ENDSW")
				.values(2)
				.expectLines("D")
				.expectDiagnostics(WarningKind.SWITCH_CASE_VALUE_OUT_OF_RANGE)
				.runAndAssert();
	}

	@Test
	public void fixedScopesHaveNoRange() throws Exception {
		flowTest("#SETRANDOM")
				.chart("#SETRANDOM 7", "#IF 7", "A", "#ENDIF", "#ENDRANDOM")
				.expectLines("A")
				.runAndAssert();
		flowTest("#SETSWITCH")
				.chart("#SETSWITCH 7", "#CASE 7", "A", "#SKIP", "#ENDSW")
				.expectLines("A")
				.runAndAssert();
	}

	@Test
	public void duplicateBranchIsRejected() throws Exception {
		flowTest("duplicate #ELSEIF")
				.chart("#RANDOM 2", "#IF 1", "A", "#ELSEIF 1", "B", "#ENDIF", "#ENDRANDOM")
				.values(1)
				.expectLines("A")
				.expectDiagnostics(WarningKind.RANDOM_DUPLICATE_IF_BRANCH_VALUE)
				.runAndAssert();
		flowTest("duplicate #CASE")
				.chart("#SWITCH 2", "#CASE 1", "A", "#SKIP", "#CASE 1", "B", "#SKIP", "#ENDSW")
				.values(1)
				.expectLines("A")
				.expectDiagnostics(WarningKind.SWITCH_DUPLICATE_CASE_VALUE)
				.runAndAssert();
		flowTest("duplicate #DEF")
				.chart("#SETSWITCH 5", "#DEF", "A", "#SKIP", "#DEF", "B", "#SKIP", "#ENDSW")
				.expectLines("A")
				.expectDiagnostics(WarningKind.SWITCH_DUPLICATE_DEF)
				.runAndAssert();
	}

	@Test
	public void sameValueInAnotherChainIsNotADuplicate() throws Exception {
		flowTest("two chains")
				.chart("#RANDOM 2", "#IF 1", "A", "#ENDIF", "#IF 1", "B", "#ENDIF", "#ENDRANDOM")
				.values(1)
				.expectLines("A", "B")
				.runAndAssert();
	}

	@Test
	public void implicitCloseMatchesExplicitTerminator() throws Exception {
		assertSameResolution(
				chart("#RANDOM 2", "#IF 1", "A", "#ENDIF", "B"),
				chart("#RANDOM 2", "#IF 1", "A", "#ENDIF", "#ENDRANDOM", "B"),
				1);
		assertSameResolution(
				chart("#RANDOM 2", "#IF 1", "A", "#ENDIF", "#RANDOM 2", "#IF 2", "B", "#ENDIF"),
				chart("#RANDOM 2", "#IF 1", "A", "#ENDIF", "#ENDRANDOM", "#RANDOM 2", "#IF 2", "B", "#ENDIF", "#ENDRANDOM"),
				1,
				2);
		assertSameResolution(
				chart("#SWITCH 2", "#CASE 1", "A", "#SKIP", "#CASE 2", "B", "#SKIP", "#RANDOM 2", "#IF 1", "C", "#ENDIF"),
				chart("#SWITCH 2", "#CASE 1", "A", "#SKIP", "#CASE 2", "B", "#SKIP", "#ENDSW", "#RANDOM 2", "#IF 1", "C", "#ENDIF"),
				2,
				1);
	}

	private static void assertSameResolution(String implicit, String explicit, long... values) throws Exception {
		Resolution first = resolve(implicit, FixedRandomSource.of(values));
		Resolution second = resolve(explicit, FixedRandomSource.of(values));
		assertEquals(texts(second.getTokens()), texts(first.getTokens()));
		assertEquals(kinds(second.getDiagnostics()), kinds(first.getDiagnostics()));
		assertTrue(first.getDiagnostics().isEmpty());
	}

	@Test
	public void implicitCloseResultsAreTheExpectedOnes() throws Exception {
		flowTest("random closed by payload")
				.chart("#RANDOM 2", "#IF 1", "A", "#ENDIF", "B")
				.values(2)
				.expectLines("B")
				.runAndAssert();
		flowTest("switch closed by #RANDOM")
				.chart("#SWITCH 2", "#CASE 1", "A", "#SKIP", "#CASE 2", "B", "#SKIP", "#RANDOM 2", "#IF 1", "C", "#ENDIF")
				.values(2, 1)
				.expectLines("B", "C")
				.runAndAssert();
	}

	@Test
	public void switchFallsThroughUntilSkip() throws Exception {
		String[] chart = {
				"#SWITCH 3",
				"#CASE 1",
				"A",
				"#CASE 2",
				"B",
				"#SKIP",
				"#CASE 3",
				"C",
				"#SKIP",
				"#ENDSW" };
		flowTest("case 1 falls into case 2").chart(chart).values(1).expectLines("A", "B").runAndAssert();
		flowTest("case 2").chart(chart).values(2).expectLines("B").runAndAssert();
		flowTest("case 3").chart(chart).values(3).expectLines("C").runAndAssert();
	}

	@Test
	public void defActivatesWhileSearchingAndFallsThrough() throws Exception {
		flowTest("#DEF first")
				.chart(
						"#SETSWITCH 2",
						"#DEF",
						"Out",
						"#CASE 2",
						"In 1",
						"#CASE 1",
						"In 2",
						"#SKIP",
						"#CASE 3",
						"In 3",
						"#SKIP",
						"#ENDSW")
				.expectLines("Out", "In 1", "In 2")
				.runAndAssert();
	}

	@Test
	public void defIsKeptWhenNoCaseMatched() throws Exception {
		flowTest("#DEF last")
				.chart("#SWITCH 3", "#CASE 1", "A", "#SKIP", "#CASE 2", "B", "#SKIP", "#DEF", "D", "#SKIP", "#ENDSW")
				.values(3)
				.expectLines("D")
				.runAndAssert();
	}

	@Test
	public void nestedScopes() throws Exception {
		flowTest("inner value 2").chart(NESTED).values(1, 2).expectLines("A", "B").runAndAssert();
		flowTest("inner value 1").chart(NESTED).values(1, 1).expectLines("A").runAndAssert();
		flowTest("outer value 2").chart(NESTED).values(2, 2).expectLines().runAndAssert();
	}

	@Test
	public void deadBranchesStillConsumeRandomValues() throws Exception {
		flowTest("dead nested random")
				.chart(
						"#RANDOM 2",
						"#IF 1",
						"#RANDOM 2",
						"#IF 1",
						"X",
						"#ENDIF",
						"#ENDRANDOM",
						"#ENDIF",
						"#ENDRANDOM",
						"#RANDOM 2",
						"#IF 1",
						"A",
						"#ENDIF",
						"#IF 2",
						"B",
						"#ENDIF",
						"#ENDRANDOM")
				.values(2, 1, 2)
				.expectLines("B")
				.runAndAssert();
	}

	@Test
	public void randomZeroOnlyKeepsElse() throws Exception {
		RandomSource unused = max -> {
			throw new AssertionError("#RANDOM 0 must not draw a value");
		};
		Resolution resolution = resolve(chart("#RANDOM 0", "#IF 1", "A", "#ELSE", "B", "#ENDIF"), unused);
		assertEquals(Arrays.asList("B"), texts(resolution.getTokens()));
		assertEquals(
				Collections.singletonList(WarningKind.RANDOM_IF_BRANCH_VALUE_OUT_OF_RANGE),
				kinds(resolution.getDiagnostics()));
	}

	@Test
	public void conditionalSkipStopsTheSwitchOnlyWhenActive() throws Exception {
		String[] chart = {
				"#SETSWITCH 1",
				"#CASE 1",
				"A",
				"#RANDOM 2",
				"#IF 1",
				"#SKIP",
				"#ENDIF",
				"#ENDRANDOM",
				"B",
				"#CASE 2",
				"C",
				"#SKIP",
				"#ENDSW" };
		flowTest("active #SKIP").chart(chart).values(1).expectLines("A").runAndAssert();
		flowTest("inactive #SKIP").chart(chart).values(2).expectLines("A", "B", "C").runAndAssert();
	}

	@Test
	public void payloadOutsideOfAnyCaseIsDropped() throws Exception {
		flowTest("tokens between cases")
				.chart("#SWITCH 2", "A", "#CASE 1", "B", "#SKIP", "C", "#ENDSW", "D")
				.values(1)
				.expectLines("B", "D")
				.runAndAssert();
	}

	@Test
	public void strayDirectivesAreReportedAndDiscarded() throws Exception {
		flowTest("stray closers")
				.chart("#ENDIF", "#ENDRANDOM", "#ENDSW", "A")
				.expectLines("A")
				.expectDiagnostics(
						WarningKind.UNMATCHED_END_IF,
						WarningKind.UNMATCHED_END_RANDOM,
						WarningKind.UNMATCHED_END_SWITCH)
				.runAndAssert();
		flowTest("stray branches")
				.chart("#ELSEIF 1", "#ELSE", "#SKIP", "#CASE 1", "#DEF", "A")
				.expectLines("A")
				.expectDiagnostics(
						WarningKind.UNMATCHED_ELSE_IF,
						WarningKind.UNMATCHED_ELSE,
						WarningKind.UNMATCHED_SKIP,
						WarningKind.UNMATCHED_CASE,
						WarningKind.UNMATCHED_DEF)
				.runAndAssert();
		flowTest("#IF without #RANDOM")
				.chart("#IF 1", "A", "#ENDIF")
				.expectLines("A")
				.expectDiagnostics(WarningKind.UNMATCHED_IF, WarningKind.UNMATCHED_END_IF)
				.runAndAssert();
	}

	@Test
	public void secondElseIsDiscarded() throws Exception {
		flowTest("two #ELSE")
				.chart("#RANDOM 2", "#IF 1", "A", "#ELSE", "B", "#ELSE", "C", "#ENDIF", "#ENDRANDOM")
				.values(2)
				.expectLines("B", "C")
				.expectDiagnostics(WarningKind.UNMATCHED_ELSE)
				.runAndAssert();
	}

	@Test
	public void elseAfterEndIfIsUnmatched() throws Exception {
		flowTest("#ELSE after #ENDIF")
				.chart("#RANDOM 2", "#IF 1", "A", "#ENDIF", "#ELSE", "B", "#ENDRANDOM")
				.values(2)
				.expectLines("B")
				.expectDiagnostics(WarningKind.UNMATCHED_ELSE, WarningKind.UNMATCHED_END_RANDOM)
				.runAndAssert();
	}

	private static final String[] END_IF_IN_CASE = {
			"#RANDOM 2",
			"#IF 1",
			"#SWITCH 2",
			"#CASE 1",
			"#IF 2",
			"A",
			"#ENDIF",
			"B",
			"#SKIP",
			"#CASE 2",
			"C",
			"#SKIP",
			"#ENDSW",
			"D",
			"#ENDIF",
			"E",
			"#ENDRANDOM" };

	private static final String[] END_RANDOM_IN_CASE = {
			"#RANDOM 2",
			"#IF 1",
			"#SWITCH 2",
			"#CASE 1",
			"A",
			"#ENDRANDOM",
			"B",
			"#SKIP",
			"#CASE 2",
			"C",
			"#ENDSW",
			"D",
			"#ENDIF",
			"#ENDRANDOM" };

	@Test
	public void endIfCannotCloseAnOpenSwitch() throws Exception {
		flowTest("#ENDIF inside a #CASE")
				.chart(END_IF_IN_CASE)
				.values(1, 2)
				.expectLines("C", "D", "E")
				.expectDiagnostics(WarningKind.UNMATCHED_IF, WarningKind.UNMATCHED_END_IF)
				.runAndAssert();
	}

	@Test
	public void endRandomCannotCloseAnOpenSwitch() throws Exception {
		flowTest("#ENDRANDOM inside a #CASE")
				.chart(END_RANDOM_IN_CASE)
				.values(1, 2)
				.expectLines("C", "D")
				.expectDiagnostics(WarningKind.UNMATCHED_END_RANDOM)
				.runAndAssert();
	}

	@Test
	public void diagnosticsCarryThePositionOfTheOffendingToken() throws Exception {
		Resolution resolution = flowTest("position").chart("A", "  #ENDIF").run();
		Diagnostic diagnostic = resolution.getDiagnostics().get(0);
		assertEquals(WarningKind.UNMATCHED_END_IF, diagnostic.getKind());
		assertEquals(new SourcePosition(2, 3), diagnostic.getPosition());
	}

	@Test
	public void valuesBeyondSixtyFourBits() throws Exception {
		BigInteger huge = new BigInteger("100000000000000000000000000000");
		String text = chart("#RANDOM " + huge, "#IF " + huge, "A", "#ENDIF", "#ENDRANDOM");
		Resolution resolution = resolve(text, new FixedRandomSource(Collections.singletonList(huge)));
		assertEquals(Arrays.asList("A"), texts(resolution.getTokens()));
		assertTrue(resolution.getDiagnostics().isEmpty());
	}

	@Test
	public void resolutionIsDeterministic() throws Exception {
		String text = chart(NESTED) + chart(IF_CHAIN);
		Resolution first = resolve(text, new BsdRandomSource(42));
		Resolution second = resolve(text, new BsdRandomSource(42));
		assertEquals(first.getTokens(), second.getTokens());
		assertEquals(first.getDiagnostics(), second.getDiagnostics());

		Resolution third = resolve(text, FixedRandomSource.of(1, 2, 3));
		Resolution fourth = resolve(text, FixedRandomSource.of(1, 2, 3));
		assertEquals(third.getTokens(), fourth.getTokens());
	}

	@Test
	public void resolvedTokensAreAllPayload() throws Exception {
		Resolution resolution = resolve(chart(NESTED) + chart(IF_CHAIN), new BsdRandomSource(7));
		for (Token token : resolution.getTokens()) {
			assertEquals(token, Resolution.requirePayload(token));
		}
	}
}
