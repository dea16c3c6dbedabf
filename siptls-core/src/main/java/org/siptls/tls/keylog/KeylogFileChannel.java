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
package org.siptls.tls.keylog;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import org.siptls.tls.shm.SharedLock;
import org.siptls.tls.shm.SharedMemory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TLSKEYLOG file.
 * <p>
 * The file contains sensitive keys for encryption! Use it with reasonable care!
 * <p>
 * The file is opened for each line and closed afterwards. That enables
 * external log rotation between two writes. All writers are serialized by a
 * lock in the {@link SharedMemory}.
 * 
 * @see <a href="https://tlswg.org/sslkeylogfile/draft-ietf-tls-keylogfile.html"
 *      target="_blank"> draft-ietf-tls-keylogfile</a>
 */
public class KeylogFileChannel {

	/**
	 * The logger.
	 */
	private static final Logger LOGGER = LoggerFactory.getLogger(KeylogFileChannel.class);

	private static final byte[] NEWLINE = { '\n' };

	private final KeylogSettings settings;
	private final SharedMemory memory;
	private final File file;
	private volatile SharedLock lock;

	/**
	 * Create file channel.
	 * 
	 * @param settings keylog settings
	 * @param memory shared memory for the lock
	 * @throws NullPointerException if any parameter is {@code null}
	 */
	public KeylogFileChannel(KeylogSettings settings, SharedMemory memory) {
		if (settings == null) {
			throw new NullPointerException("settings must not be null!");
		}
		if (memory == null) {
			throw new NullPointerException("shared memory must not be null!");
		}
		this.settings = settings;
		this.memory = memory;
		this.file = settings.getFile().isEmpty() ? null : new File(settings.getFile());
	}

	/**
	 * Initialize channel.
	 * 
	 * @return {@link KeylogResult#SUCCESS}, if the channel is not selected,
	 *         already initialized or initialized successfully,
	 *         {@link KeylogResult#MISSING_PARAMETER}, if no file is
	 *         configured, {@link KeylogResult#LOCK_ALLOCATION_FAILURE}, if no
	 *         shared memory is left for the lock, or
	 *         {@link KeylogResult#LOCK_INIT_FAILURE}, if the lock could not be
	 *         initialized.
	 */
	public synchronized KeylogResult init() {
		if (!settings.isSelected(KeylogMode.FILE)) {
			return KeylogResult.SUCCESS;
		}
		if (file == null) {
			LOGGER.warn("TLSKEYLOG: file mode without file!");
			return KeylogResult.MISSING_PARAMETER;
		}
		if (lock != null) {
			return KeylogResult.SUCCESS;
		}
		SharedLock lock = memory.allocateLock();
		if (lock == null) {
			LOGGER.warn("TLSKEYLOG: no memory left for lock!");
			return KeylogResult.LOCK_ALLOCATION_FAILURE;
		}
		if (!lock.init()) {
			LOGGER.warn("TLSKEYLOG: lock initialization failed!");
			lock.destroy();
			return KeylogResult.LOCK_INIT_FAILURE;
		}
		this.lock = lock;
		LOGGER.info("TLSKEYLOG: {}", file.getAbsolutePath());
		return KeylogResult.SUCCESS;
	}

	/**
	 * Check, if channel is initialized.
	 * 
	 * @return {@code true}, if initialized, {@code false}, otherwise.
	 */
	public boolean isEnabled() {
		return lock != null;
	}

	/**
	 * Append line to keylog file.
	 * 
	 * @param line line to append. A newline is added.
	 * @return {@link KeylogResult#SUCCESS}, if the channel is not initialized
	 *         or the line is appended, {@link KeylogResult#IO_FAILURE}, if the
	 *         file could not be opened or written.
	 * @throws NullPointerException if line is {@code null}
	 */
	public KeylogResult write(String line) {
		if (line == null) {
			throw new NullPointerException("line must not be null!");
		}
		SharedLock lock = this.lock;
		if (lock == null) {
			return KeylogResult.SUCCESS;
		}
		byte[] data = line.getBytes(StandardCharsets.UTF_8);
		try {
			lock.lock();
		} catch (IllegalStateException ex) {
			LOGGER.debug("TLSKEYLOG: file channel closed");
			return KeylogResult.SUCCESS;
		}
		try (OutputStream out = new FileOutputStream(file, true)) {
			out.write(data);
			out.write(NEWLINE);
		} catch (IOException e) {
			LOGGER.error("TLSKEYLOG: failed to write keylog file {}: {}", file.getAbsolutePath(), e.getMessage());
			return KeylogResult.IO_FAILURE;
		} finally {
			lock.unlock();
		}
		return KeylogResult.SUCCESS;
	}

	/**
	 * Close channel.
	 * 
	 * Destroys the lock. Following writes are ignored.
	 */
	public synchronized void close() {
		SharedLock lock = this.lock;
		if (lock != null) {
			this.lock = null;
			lock.destroy();
		}
	}
}
