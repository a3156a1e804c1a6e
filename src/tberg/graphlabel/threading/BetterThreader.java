package tberg.graphlabel.threading;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed pool of threads that drain a shared list of work items. Each thread
 * owns an optional argument (scratch space, a per-thread model copy) that is
 * passed along with every item it pulls. A threader runs once.
 * <p>
 * If any call throws, the remaining items are abandoned and {@link #run()}
 * rethrows the first failure once every thread has stopped.
 */
public class BetterThreader<A,B> {

	public static interface Function<A, B> {
		public void call(A a, B b);
	}

	boolean locked;
	int doneCount;
	Function<A,B> func;
	List<A> funcArguments;
	Thread[] pool;
	Throwable failure;

	public BetterThreader(Function<A,B> func, int numThreads) {
		if (numThreads < 1) throw new IllegalArgumentException("Need at least one thread, got " + numThreads);
		funcArguments = new ArrayList<A>();
		this.func = func;
		this.pool = new Thread[numThreads];
		for (int t=0; t<numThreads; ++t) {
			this.pool[t] = new ThreaderThread(t);
		}
		locked = false;
	}

	public void run() {
		synchronized (funcArguments) {
			if (locked) throw new IllegalStateException("Better threader has already run.");
			locked = true;
			doneCount = 0;
		}
		if (pool.length == 1) {
			((ThreaderThread) pool[0]).drain();
		} else {
			for (Thread t : pool) t.start();
			for (Thread t : pool) {
				try {
					t.join();
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					synchronized (funcArguments) {
						funcArguments.clear();
					}
					throw new RuntimeException("Interrupted while waiting for worker threads", e);
				}
			}
		}
		synchronized (funcArguments) {
			if (failure != null) {
				if (failure instanceof RuntimeException) throw (RuntimeException) failure;
				if (failure instanceof Error) throw (Error) failure;
				throw new RuntimeException(failure);
			}
		}
	}

	public int numThreads() {
		return pool.length;
	}

	public int doneCount() {
		synchronized (funcArguments) {
			return doneCount;
		}
	}

	public void addFunctionArgument(A a) {
		synchronized (funcArguments) {
			if (!locked) funcArguments.add(a);
			else throw new IllegalStateException("Better threader is locked.");
		}
	}

	public void setThreadArgument(int t, B b) {
		synchronized (funcArguments) {
			if (!locked) ((ThreaderThread) pool[t]).setArgument(b);
			else throw new IllegalStateException("Better threader is locked.");
		}
	}

	private A popWork() {
		synchronized (funcArguments) {
			if (funcArguments.isEmpty() || failure != null) return null;
			else return funcArguments.remove(0);
		}
	}

	private class ThreaderThread extends Thread {
		B b = null;

		ThreaderThread(int t) {
			super("better-threader-" + t);
			setDaemon(true);
		}

		public void setArgument(B b) {
			this.b = b;
		}

		void drain() {
			A a = null;
			while ((a = popWork()) != null) {
				try {
					func.call(a, b);
				} catch (Throwable e) {
					synchronized (funcArguments) {
						if (failure == null) failure = e;
						else failure.addSuppressed(e);
					}
					return;
				}
				synchronized (funcArguments) {
					doneCount++;
				}
			}
		}

		public void run() {
			drain();
		}
	}

}
