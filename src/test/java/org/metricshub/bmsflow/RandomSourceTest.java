package org.metricshub.bmsflow;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.bmsflow.jrt.BsdRandomSource;
import org.metricshub.bmsflow.jrt.FixedRandomSource;
import org.metricshub.bmsflow.jrt.RandomSource;
import org.metricshub.bmsflow.jrt.ThreadLocalRandomSource;

public class RandomSourceTest {

	private static final BigInteger HUGE = BigInteger.ONE.shiftLeft(100).add(BigInteger.valueOf(3));

	private static void assertInRange(RandomSource source, BigInteger max, int draws) {
		for (int i = 0; i < draws; i++) {
			BigInteger value = source.next(max);
			assertTrue(value + " <= 0", value.signum() > 0);
			assertTrue(value + " > " + max, value.compareTo(max) <= 0);
		}
	}

	@Test
	public void bsdSourceIsReproducible() {
		BsdRandomSource first = new BsdRandomSource(2024);
		BsdRandomSource second = new BsdRandomSource(2024);
		for (int i = 0; i < 50; i++) {
			BigInteger max = BigInteger.valueOf(1 + i % 7);
			assertEquals(first.next(max), second.next(max));
		}
	}

	@Test
	public void bsdSourceStaysInRange() {
		BsdRandomSource source = new BsdRandomSource(1);
		for (int max = 1; max <= 10; max++) {
			assertInRange(source, BigInteger.valueOf(max), 200);
		}
		assertInRange(source, HUGE, 200);
	}

	@Test
	public void bsdSourceReachesEveryValue() {
		BsdRandomSource source = new BsdRandomSource(3);
		boolean[] seen = new boolean[4];
		for (int i = 0; i < 400; i++) {
			seen[source.next(BigInteger.valueOf(4)).intValue() - 1] = true;
		}
		for (boolean b : seen) {
			assertTrue(b);
		}
	}

	@Test
	public void threadLocalSourceStaysInRange() {
		assertInRange(ThreadLocalRandomSource.INSTANCE, BigInteger.ONE, 20);
		assertInRange(ThreadLocalRandomSource.INSTANCE, BigInteger.valueOf(6), 200);
		assertInRange(ThreadLocalRandomSource.INSTANCE, HUGE, 200);
	}

	@Test
	public void nonPositiveBoundIsRejected() {
		assertThrows(IllegalArgumentException.class, () -> new BsdRandomSource(1).next(BigInteger.ZERO));
		assertThrows(IllegalArgumentException.class, () -> ThreadLocalRandomSource.INSTANCE.next(BigInteger.ZERO));
	}

	@Test
	public void fixedSourceCyclesThroughItsValues() {
		FixedRandomSource source = FixedRandomSource.of(3, 1);
		List<BigInteger> drawn = new ArrayList<BigInteger>();
		for (int i = 0; i < 5; i++) {
			drawn.add(source.next(BigInteger.TEN));
		}
		assertEquals(
				Arrays
						.asList(
								BigInteger.valueOf(3),
								BigInteger.ONE,
								BigInteger.valueOf(3),
								BigInteger.ONE,
								BigInteger.valueOf(3)),
				drawn);
	}

	@Test
	public void fixedSourceParsesCommandLineValues() {
		FixedRandomSource source = FixedRandomSource.parse("1, 2,,3");
		assertEquals(Arrays.asList(BigInteger.ONE, BigInteger.valueOf(2), BigInteger.valueOf(3)), source.getValues());
		assertThrows(IllegalArgumentException.class, () -> FixedRandomSource.parse("a"));
		assertThrows(IllegalArgumentException.class, () -> FixedRandomSource.parse("-1"));
		assertThrows(IllegalArgumentException.class, () -> FixedRandomSource.parse(" , "));
	}
}
