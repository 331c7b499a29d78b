package org.metricshub.bmsflow;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.metricshub.bmsflow.BmsTestSupport.kinds;

import java.math.BigInteger;
import java.util.Arrays;
import org.junit.Test;
import org.metricshub.bmsflow.backend.ScopeFrame;
import org.metricshub.bmsflow.backend.ScopeTracker;
import org.metricshub.bmsflow.backend.WarningKind;
import org.metricshub.bmsflow.frontend.SourcePosition;
import org.metricshub.bmsflow.frontend.ast.BlockValue;
import org.metricshub.bmsflow.jrt.FixedRandomSource;

public class ScopeTrackerTest {

	private static final SourcePosition POS = new SourcePosition(1, 1);

	private static BigInteger big(long value) {
		return BigInteger.valueOf(value);
	}

	@Test
	public void rootIsActive() {
		ScopeTracker tracker = new ScopeTracker(FixedRandomSource.of(1));
		assertTrue(tracker.isActive());
		assertEquals(0, tracker.depth());
		assertEquals(ScopeFrame.Kind.ROOT, tracker.top().getKind());
	}

	@Test
	public void randomScopeIsTransparent() {
		ScopeTracker tracker = new ScopeTracker(FixedRandomSource.of(2));
		tracker.openRandom(BlockValue.random(3), POS);
		assertTrue(tracker.isActive());
		assertEquals(big(2), tracker.top().getGenerated());

		tracker.openIf(big(1), POS);
		assertFalse(tracker.isActive());
		tracker.openElseIf(big(2), POS);
		assertTrue(tracker.isActive());
		tracker.openElse(POS);
		assertFalse(tracker.isActive());
		assertTrue(tracker.top().isElseBranch());

		tracker.closeIf(POS);
		assertEquals(1, tracker.depth());
		tracker.closeRandom(POS);
		assertEquals(0, tracker.depth());
		assertTrue(tracker.getDiagnostics().isEmpty());
	}

	@Test
	public void switchStates() {
		ScopeTracker tracker = new ScopeTracker(FixedRandomSource.of(1));
		tracker.openSwitch(BlockValue.set(2), POS);
		ScopeFrame sw = tracker.top();
		assertEquals(ScopeFrame.SwitchState.SEARCHING, sw.getSwitchState());
		assertFalse("no case open yet", tracker.isActive());

		tracker.openCase(big(1), POS);
		assertEquals(ScopeFrame.SwitchState.SEARCHING, sw.getSwitchState());
		assertFalse(tracker.isActive());

		tracker.openCase(big(2), POS);
		assertEquals(ScopeFrame.SwitchState.ACTIVE, sw.getSwitchState());
		assertTrue(tracker.isActive());

		tracker.openCase(big(3), POS);
		assertTrue("fallthrough", tracker.isActive());

		tracker.skip(POS);
		assertEquals(ScopeFrame.SwitchState.SKIPPED, sw.getSwitchState());
		assertFalse(sw.isCaseOpen());

		tracker.openDef(POS);
		assertFalse("skipped is terminal", tracker.isActive());

		tracker.closeSwitch(POS);
		assertEquals(0, tracker.depth());
	}

	@Test
	public void payloadClosesARandomScopeWithoutBranch() {
		ScopeTracker tracker = new ScopeTracker(FixedRandomSource.of(1));
		tracker.openRandom(BlockValue.random(2), POS);
		assertEquals(1, tracker.depth());
		assertTrue(tracker.acceptPayload());
		assertEquals(0, tracker.depth());
	}

	@Test
	public void newIfEndsTheCurrentBranch() {
		ScopeTracker tracker = new ScopeTracker(FixedRandomSource.of(1));
		tracker.openRandom(BlockValue.random(2), POS);
		tracker.openIf(big(2), POS);
		assertFalse(tracker.isActive());
		tracker.openIf(big(1), POS);
		assertTrue(tracker.isActive());
		assertEquals("random + one branch", 2, tracker.depth());
	}

	@Test
	public void closersPopEverythingAboveTheirScope() {
		ScopeTracker tracker = new ScopeTracker(FixedRandomSource.of(1));
		tracker.openSwitch(BlockValue.random(2), POS);
		tracker.openCase(big(1), POS);
		tracker.openRandom(BlockValue.random(2), POS);
		tracker.openIf(big(1), POS);
		assertEquals(3, tracker.depth());
		tracker.closeSwitch(POS);
		assertEquals(0, tracker.depth());
		assertTrue(tracker.getDiagnostics().isEmpty());
	}

	@Test
	public void endersDoNotReachThroughAnOpenSwitch() {
		ScopeTracker tracker = new ScopeTracker(FixedRandomSource.of(1));
		tracker.openRandom(BlockValue.random(2), POS);
		tracker.openIf(big(1), POS);
		tracker.openSwitch(BlockValue.random(2), POS);
		tracker.openCase(big(1), POS);
		tracker.closeIf(POS);
		tracker.closeRandom(POS);
		assertEquals(3, tracker.depth());
		assertEquals(ScopeFrame.Kind.SWITCH, tracker.top().getKind());
		assertEquals(
				Arrays.asList(WarningKind.UNMATCHED_END_IF, WarningKind.UNMATCHED_END_RANDOM),
				kinds(tracker.getDiagnostics()));
		tracker.closeSwitch(POS);
		tracker.closeIf(POS);
		assertEquals(1, tracker.depth());
		assertEquals(2, tracker.getDiagnostics().size());
	}

	@Test
	public void endIfWithRandomOnTopIsUnmatched() {
		ScopeTracker tracker = new ScopeTracker(FixedRandomSource.of(1));
		tracker.openRandom(BlockValue.random(2), POS);
		tracker.openIf(big(1), POS);
		tracker.openRandom(BlockValue.random(2), POS);
		tracker.closeIf(new SourcePosition(4, 1));
		assertEquals(WarningKind.UNMATCHED_END_IF, tracker.getDiagnostics().get(0).getKind());
		assertEquals(3, tracker.depth());
	}

	@Test
	public void caseOutsideOfSwitchLeavesRandomOpen() {
		ScopeTracker tracker = new ScopeTracker(FixedRandomSource.of(1));
		tracker.openRandom(BlockValue.random(2), POS);
		tracker.openCase(big(1), POS);
		assertEquals(WarningKind.UNMATCHED_CASE, tracker.getDiagnostics().get(0).getKind());
		assertEquals(ScopeFrame.Kind.RANDOM, tracker.top().getKind());
	}
}
