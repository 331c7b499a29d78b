package org.metricshub.bmsflow;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.Set;
import org.junit.Test;
import org.metricshub.bmsflow.backend.ConditionValidator;
import org.metricshub.bmsflow.backend.WarningKind;
import org.metricshub.bmsflow.frontend.ast.BlockValue;

public class ConditionValidatorTest {

	private static final BigInteger ONE = BigInteger.ONE;
	private static final BigInteger TWO = BigInteger.valueOf(2);
	private static final BigInteger FIVE = BigInteger.valueOf(5);

	@Test
	public void ifConditionsAreCheckedAgainstTheRandomRange() {
		Set<BigInteger> seen = new HashSet<BigInteger>();
		BlockValue scope = BlockValue.random(2);
		assertNull(ConditionValidator.validateIf(scope, seen, ONE));
		assertEquals(WarningKind.RANDOM_DUPLICATE_IF_BRANCH_VALUE, ConditionValidator.validateIf(scope, seen, ONE));
		assertEquals(WarningKind.RANDOM_IF_BRANCH_VALUE_OUT_OF_RANGE, ConditionValidator.validateIf(scope, seen, FIVE));
		assertEquals(WarningKind.RANDOM_IF_BRANCH_VALUE_OUT_OF_RANGE, ConditionValidator.validateIf(scope, seen, BigInteger.ZERO));
		assertTrue(seen.contains(ONE));
		assertEquals(1, seen.size());
	}

	@Test
	public void setScopesAcceptAnyValue() {
		Set<BigInteger> seen = new HashSet<BigInteger>();
		assertNull(ConditionValidator.validateIf(BlockValue.set(2), seen, FIVE));
		assertNull(ConditionValidator.validateCase(BlockValue.set(2), new HashSet<BigInteger>(), FIVE));
	}

	@Test
	public void rejectedCaseIsNotRemembered() {
		Set<BigInteger> seen = new HashSet<BigInteger>();
		BlockValue scope = BlockValue.random(3);
		assertEquals(WarningKind.SWITCH_CASE_VALUE_OUT_OF_RANGE, ConditionValidator.validateCase(scope, seen, FIVE));
		assertTrue(seen.isEmpty());
		assertNull(ConditionValidator.validateCase(scope, seen, TWO));
		assertEquals(WarningKind.SWITCH_DUPLICATE_CASE_VALUE, ConditionValidator.validateCase(scope, seen, TWO));
	}

	@Test
	public void onlyOneDef() {
		assertNull(ConditionValidator.validateDef(false));
		assertEquals(WarningKind.SWITCH_DUPLICATE_DEF, ConditionValidator.validateDef(true));
	}

	@Test
	public void generatedValues() {
		BlockValue scope = BlockValue.random(2);
		assertNull(ConditionValidator.validateGenerated(scope, TWO, WarningKind.RANDOM_VALUE_OUT_OF_RANGE));
		assertEquals(
				WarningKind.SWITCH_VALUE_OUT_OF_RANGE,
				ConditionValidator.validateGenerated(scope, FIVE, WarningKind.SWITCH_VALUE_OUT_OF_RANGE));
	}
}
