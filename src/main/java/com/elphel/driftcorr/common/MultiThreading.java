/**
 **
 ** MultiThreading.java - thread pool helpers for per-layer and per-row loops
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  MultiThreading.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */

package com.elphel.driftcorr.common;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

public class MultiThreading {
	public static int THREADS_MAX = 100;
	/* Create a Thread[] array as large as the number of processors available.
	 * From Stephan Preibisch's Multithreading.java class. See:
	 * http://repo.or.cz/w/trakem2.git?a=blob;f=mpi/fruitfly/general/MultiThreading.java;hb=HEAD
	 */
	public static Thread[] newThreadArray() {
		return newThreadArray (THREADS_MAX);
	}
	public static Thread[] newThreadArray(int maxCPUs) {
		int n_cpus = Runtime.getRuntime().availableProcessors();
		if (maxCPUs < 1) maxCPUs = 1;
		if (n_cpus>maxCPUs)n_cpus=maxCPUs;
		return new Thread[n_cpus];
	}

	/**
	 * Element processor for {@link #runIndexed(int, int, IndexTask, ProgressMonitor)}.
	 */
	public interface IndexTask {
		void process(int index);
	}

	/**
	 * Run task for indices 0..num_items-1 on up to threadsMax threads, each thread taking the
	 * next free index. Progress is reported after each finished item, cancellation is checked
	 * before each item is started.
	 * @param num_items number of independent items (layers, rows)
	 * @param threadsMax maximal number of threads
	 * @param task per-item work
	 * @param monitor optional progress/cancellation monitor, may be null
	 * @throws CancellationException if the monitor requested cancellation
	 * @throws Error the first error thrown by a worker, rethrown as is
	 */
	public static void runIndexed(
			final int             num_items,
			final int             threadsMax,
			final IndexTask       task,
			final ProgressMonitor monitor) {
		if (num_items <= 0) {
			return;
		}
		final Thread[] threads = newThreadArray(Math.min(threadsMax, num_items));
		final AtomicInteger ai = new AtomicInteger(0);
		final AtomicInteger ai_done = new AtomicInteger(0);
		final Throwable [] failure = new Throwable[1];
		for (int ithread = 0; ithread < threads.length; ithread++) {
			threads[ithread] = new Thread() {
				@Override
				public void run() {
					for (int nItem = ai.getAndIncrement(); nItem < num_items; nItem = ai.getAndIncrement()) {
						if ((monitor != null) && monitor.isCanceled()) {
							break;
						}
						try {
							task.process(nItem);
						} catch (Throwable e) { // including errors
							synchronized (failure) {
								if (failure[0] == null) failure[0] = e;
							}
							ai.set(num_items); // stop other threads
							break;
						}
						int done = ai_done.incrementAndGet();
						if (monitor != null) {
							monitor.progress(done, num_items);
						}
					}
				}
			};
		}
		startAndJoin(threads);
		if (failure[0] instanceof RuntimeException) {
			throw (RuntimeException) failure[0];
		} else if (failure[0] instanceof Error) {
			throw (Error) failure[0];
		} else if (failure[0] != null) {
			throw new IllegalStateException(failure[0]);
		}
		if ((monitor != null) && monitor.isCanceled()) {
			throw new CancellationException("Canceled after "+ai_done.get()+" of "+num_items+" items");
		}
	}

/* Start all given threads and wait on each of them until all are done.
	 * From Stephan Preibisch's Multithreading.java class. See:
	 * http://repo.or.cz/w/trakem2.git?a=blob;f=mpi/fruitfly/general/MultiThreading.java;hb=HEAD
	 */
	public static void startAndJoin(Thread[] threads)
	{
		for (int ithread = 0; ithread < threads.length; ++ithread)
		{
			threads[ithread].setPriority(Thread.NORM_PRIORITY);
			threads[ithread].start();
		}
		try
		{
			for (int ithread = 0; ithread < threads.length; ++ithread)
				threads[ithread].join();
		} catch (InterruptedException ie)
		{
			Thread.currentThread().interrupt();
			throw new RuntimeException(ie);
		}
	}
}
