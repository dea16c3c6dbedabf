/********************************************************************************
 * Copyright (c) 2026 Contributors to the Eclipse Foundation
 * 
 * See the NOTICE file(s) distributed with this work for additional
 * information regarding copyright ownership.
 * 
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License v. 2.0 which is available at
 * https://www.eclipse.org/legal/epl-2.0, or the Eclipse Distribution License
 * v1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 * 
 * SPDX-License-Identifier: EPL-2.0 OR BSD-3-Clause
 ********************************************************************************/
package org.siptls.tls.config;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import javax.security.auth.DestroyFailedException;
import javax.security.auth.Destroyable;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.siptls.tls.category.Medium;
import org.siptls.tls.rule.TestNameLoggerRule;

@Category(Medium.class)
public class ConfigGenerationRegistryTest {

	@Rule
	public TestNameLoggerRule name = new TestNameLoggerRule();

	private ConfigGenerationRegistry<String> registry;

	@Before
	public void setUp() {
		registry = new ConfigGenerationRegistry<String>();
	}

	@Test
	public void testCheckoutActive() {
		long number = registry.install("domains-1");
		ConfigReference<String> reference = registry.checkout();
		assertThat(reference.get(), is("domains-1"));
		assertThat(reference.getGenerationNumber(), is(number));
		assertThat(registry.getActive().getReferenceCount(), is(1));
		registry.checkin(reference);
		assertThat(reference.isCheckedIn(), is(true));
		assertThat(registry.getActive().getReferenceCount(), is(0));
	}

	@Test(expected = IllegalStateException.class)
	public void testCheckoutWithoutInstall() {
		registry.checkout();
	}

	@Test(expected = IllegalStateException.class)
	public void testDoubleCheckin() {
		registry.install("domains-1");
		ConfigReference<String> reference = registry.checkout();
		registry.checkin(reference);
		registry.checkin(reference);
	}

	@Test
	public void testDoubleCheckinKeepsCounter() {
		registry.install("domains-1");
		ConfigReference<String> reference1 = registry.checkout();
		ConfigReference<String> reference2 = registry.checkout();
		registry.checkin(reference1);
		try {
			registry.checkin(reference1);
		} catch (IllegalStateException ex) {
			// expected
		}
		assertThat(registry.getActive().getReferenceCount(), is(1));
		registry.checkin(reference2);
		assertThat(registry.getActive().getReferenceCount(), is(0));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testCheckinOtherRegistry() {
		ConfigGenerationRegistry<String> other = new ConfigGenerationRegistry<String>();
		other.install("other");
		registry.install("domains-1");
		registry.checkin(other.checkout());
	}

	@Test(expected = IllegalStateException.class)
	public void testGetAfterCheckin() {
		registry.install("domains-1");
		ConfigReference<String> reference = registry.checkout();
		reference.close();
		reference.get();
	}

	@Test
	public void testTryWithResources() {
		registry.install("domains-1");
		try (ConfigReference<String> reference = registry.checkout()) {
			assertThat(reference.get(), is("domains-1"));
		}
		assertThat(registry.getActive().getReferenceCount(), is(0));
	}

	@Test
	public void testCollectEmpty() {
		assertThat(registry.collect(), is(0));
		assertThat(registry.size(), is(0));
	}

	@Test
	public void testCollectNeverRemovesHead() {
		registry.install("domains-1");
		assertThat(registry.getActive().getReferenceCount(), is(0));
		assertThat(registry.collect(), is(0));
		assertThat(registry.size(), is(1));
		assertThat(registry.checkout().get(), is("domains-1"));
	}

	@Test
	public void testCollectUnreferencedPredecessors() {
		// head=G3(0) -> G2(0) -> G1(2)
		registry.install("domains-1");
		ConfigReference<String> reference1 = registry.checkout();
		ConfigReference<String> reference2 = registry.checkout();
		registry.install("domains-2");
		registry.install("domains-3");
		assertThat(registry.collect(), is(1));
		assertNumbers(3L, 1L);

		registry.checkin(reference1);
		assertThat(registry.collect(), is(0));
		registry.checkin(reference2);
		assertThat(registry.collect(), is(1));
		assertNumbers(3L);
	}

	@Test
	public void testCollectKeepsOrderOfSurvivors() {
		List<ConfigReference<String>> references = new ArrayList<>();
		for (int index = 1; index <= 6; ++index) {
			registry.install("domains-" + index);
			if (index % 2 == 1) {
				references.add(registry.checkout());
			}
		}
		registry.install("domains-7");
		// G7(0) -> G6(0) -> G5(1) -> G4(0) -> G3(1) -> G2(0) -> G1(1)
		assertThat(registry.collect(), is(3));
		assertNumbers(7L, 5L, 3L, 1L);
		for (ConfigGeneration<String> generation : registry.getGenerations()) {
			assertThat(generation.isDestroyed(), is(false));
		}
		for (ConfigReference<String> reference : references) {
			reference.close();
		}
		assertThat(registry.collect(), is(3));
		assertNumbers(7L);
	}

	@Test
	public void testCollectArbitraryCounts() {
		Random random = new Random(4711);
		for (int round = 0; round < 50; ++round) {
			registry = new ConfigGenerationRegistry<String>();
			int count = random.nextInt(10) + 1;
			List<Long> expected = new ArrayList<>();
			for (int index = 0; index < count; ++index) {
				long number = registry.install("domains-" + index);
				int refs = random.nextInt(3);
				for (int ref = 0; ref < refs; ++ref) {
					registry.checkout();
				}
				if (refs > 0 || index == count - 1) {
					expected.add(0, number);
				}
			}
			int removed = registry.collect();
			assertThat(removed, is(count - expected.size()));
			List<Long> numbers = new ArrayList<>();
			for (ConfigGeneration<String> generation : registry.getGenerations()) {
				numbers.add(generation.getNumber());
			}
			assertThat(numbers, is(expected));
		}
	}

	@Test
	public void testCollectDestroysPayload() throws DestroyFailedException {
		ConfigGenerationRegistry<Destroyable> destroyables = new ConfigGenerationRegistry<Destroyable>();
		Destroyable first = mock(Destroyable.class);
		Destroyable second = mock(Destroyable.class);
		destroyables.install(first);
		ConfigGeneration<Destroyable> generation = destroyables.getActive();
		destroyables.install(second);
		assertThat(destroyables.collect(), is(1));
		verify(first, times(1)).destroy();
		verify(second, never()).destroy();
		assertThat(generation.isDestroyed(), is(true));
		assertThat(generation.getPayload(), is(nullValue()));
	}

	@Test
	public void testInstallNumbersIncrease() {
		long first = registry.install("domains-1");
		long second = registry.install("domains-2");
		assertThat(second, is(first + 1));
		assertThat(registry.getActive().getNumber(), is(second));
	}

	@Test
	public void testConcurrentCollect() throws Exception {
		final AtomicInteger destroyed = new AtomicInteger();
		final ConfigGenerationRegistry<Destroyable> destroyables = new ConfigGenerationRegistry<Destroyable>();
		int generations = 200;
		for (int index = 0; index < generations; ++index) {
			destroyables.install(new Destroyable() {

				private boolean done;

				@Override
				public synchronized void destroy() throws DestroyFailedException {
					if (done) {
						throw new DestroyFailedException("destroyed twice!");
					}
					done = true;
					destroyed.incrementAndGet();
				}

				@Override
				public synchronized boolean isDestroyed() {
					return done;
				}
			});
		}
		int threads = 8;
		final CyclicBarrier barrier = new CyclicBarrier(threads);
		final AtomicInteger removed = new AtomicInteger();
		final AtomicReference<Throwable> failure = new AtomicReference<Throwable>();
		final CountDownLatch done = new CountDownLatch(threads);
		for (int index = 0; index < threads; ++index) {
			Thread thread = new Thread(new Runnable() {

				@Override
				public void run() {
					try {
						barrier.await();
						removed.addAndGet(destroyables.collect());
					} catch (Throwable t) {
						failure.set(t);
					} finally {
						done.countDown();
					}
				}
			});
			thread.start();
		}
		assertThat(done.await(5000, TimeUnit.MILLISECONDS), is(true));
		assertThat(failure.get(), is(nullValue()));
		assertThat(removed.get(), is(generations - 1));
		assertThat(destroyed.get(), is(generations - 1));
		assertThat(destroyables.size(), is(1));
	}

	@Test
	public void testCheckoutRacingInstall() throws Exception {
		registry.install("domains-0");
		final int rounds = 2000;
		final AtomicReference<String> failure = new AtomicReference<String>();
		final CountDownLatch done = new CountDownLatch(2);
		Thread installer = new Thread(new Runnable() {

			@Override
			public void run() {
				for (int index = 1; index <= rounds; ++index) {
					registry.install("domains-" + index);
					registry.collect();
				}
				done.countDown();
			}
		});
		Thread connections = new Thread(new Runnable() {

			@Override
			public void run() {
				for (int index = 0; index < rounds; ++index) {
					ConfigReference<String> reference = registry.checkout();
					String payload = reference.get();
					if (payload == null) {
						failure.set("checked out collected generation " + reference);
					}
					reference.close();
				}
				done.countDown();
			}
		});
		installer.start();
		connections.start();
		assertThat(done.await(10000, TimeUnit.MILLISECONDS), is(true));
		assertThat(failure.get(), is(nullValue()));
		registry.collect();
		assertThat(registry.size(), is(1));
		assertThat(registry.getActive().getNumber(), is((long) rounds + 1));
	}

	@Test
	public void testReplacedGenerationIsKeptWhileReferenced() {
		registry.install("domains-1");
		ConfigReference<String> reference = registry.checkout();
		registry.install("domains-2");
		registry.collect();
		assertThat(reference.get(), is("domains-1"));
		assertThat(registry.size(), is(2));
		reference.close();
		registry.collect();
		assertThat(registry.size(), is(1));
	}

	private void assertNumbers(Long... numbers) {
		List<Long> actual = new ArrayList<>();
		for (ConfigGeneration<String> generation : registry.getGenerations()) {
			actual.add(generation.getNumber());
		}
		assertThat(actual, is(Arrays.asList(numbers)));
	}
}
