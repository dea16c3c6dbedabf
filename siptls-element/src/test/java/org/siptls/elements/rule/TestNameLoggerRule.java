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
package org.siptls.elements.rule;

import org.junit.rules.TestWatcher;
import org.junit.runner.Description;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rule to write test names using the logger.
 */
public class TestNameLoggerRule extends TestWatcher {

	public static final Logger LOGGER = LoggerFactory.getLogger(TestNameLoggerRule.class);

	@Override
	protected void starting(Description description) {
		LOGGER.info("Test {}", description.getMethodName());
	}

	@Override
	protected void failed(Throwable e, Description description) {
		LOGGER.warn("Test {} failed: {}", description.getMethodName(), e.getMessage());
	}
}
