/**
 * IO.java
 */
package flint.ds;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.concurrent.locks.Lock;
import java.util.zip.GZIPInputStream;

/**
 * Utility class for file and stream operations, including path resolution,
 * compressed input and resource management.
 */
public final class IO {
	static final int GZIP_BUFSZ = 8192;
	static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

	private IO() {
	}

	public static File path(final String path) {
		final String s = path //
				.replace("~", System.getProperty("user.home")) //
				.replace("${HOME}", System.getProperty("user.home")) //
		;
		return new File(s);
	}

	/**
	 * Opens a file for reading, decompressing .gz files
	 * @param file the file to read
	 * @return input stream positioned at the first byte of content
	 * @throws IOException if the file cannot be opened
	 */
	static InputStream stream(final File file) throws IOException {
		try {
			if (file.getName().endsWith(".gz"))
				return new GZIPInputStream(new FileInputStream(file), GZIP_BUFSZ);
			return new FileInputStream(file);
		} catch (java.io.EOFException ex) {
			throw new java.io.EOFException("EOF " + file.getCanonicalPath());
		}
	}

	/**
	 * A utility class for managing resources that need to be closed.
	 * Resources are closed in reverse order of their registration; a registered
	 * lock is released the same way.
	 */
	public static final class Closer implements AutoCloseable {
		final ArrayList<AutoCloseable> a = new ArrayList<>();

		public Closer() {
		}

		/**
		 * Acquires the lock and releases it on close.
		 * @param lock the lock to manage
		 */
		public Closer(final Lock lock) {
			lock(lock);
		}

		/**
		 * Registers a closeable resource.
		 * @param <T> the type of the object
		 * @param object the object to register
		 * @return the registered object
		 */
		public <T extends AutoCloseable> T register(final T object) {
			if (null != object)
				a.add(object);
			return object;
		}

		public void lock(final Lock lock) {
			lock.lock();
			a.add(() -> {
				lock.unlock();
			});
		}

		/**
		 * Close all registered resources in reverse order
		 */
		@Override
		public void close() {
			for (int i = a.size() - 1; i >= 0; i--) {
				final AutoCloseable o = a.get(i);
				try {
					o.close();
				} catch (RuntimeException ex) {
					throw ex;
				} catch (Exception ex) {
					throw new RuntimeException(ex);
				}
			}
			a.clear();
		}
	}

	/**
	 * A simple stopwatch for request timing.
	 */
	public static final class StopWatch {
		private long start;

		public StopWatch() {
			reset();
		}

		public void reset() {
			start = System.currentTimeMillis();
		}

		public long elapsed() {
			return System.currentTimeMillis() - start;
		}
	}
}
