package work.rescuekit.exec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.rescuekit.module.Module;
import work.rescuekit.module.ModuleRunFailureException;

/**
 * Fixed set of worker threads draining a shared {@link WorkQueue} batch by batch.
 *
 * <p>The control thread enqueues one batch and waits for it to drain before the next one. After the last
 * batch it enqueues one shutdown marker per worker, waits for those to drain and joins every worker, so
 * each {@link #run} starts a fresh set. A module that fails to run, including one whose executor throws an
 * {@link Error}, is logged and acknowledged; it never stops its worker.</p>
 */
public final class WorkerPool {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private static final WorkItem SHUTDOWN = new WorkItem(null);

    private final int concurrency;
    private final ModuleExecutor executor;
    private final RunContext context;
    private final WorkQueue<WorkItem> queue = new WorkQueue<>();
    private final List<Thread> workers = new ArrayList<>();
    private final ConcurrentLinkedQueue<Module> failures = new ConcurrentLinkedQueue<>();

    public WorkerPool(int concurrency, ModuleExecutor executor, RunContext context) {
        this.concurrency = Math.max(1, concurrency);
        this.executor = Objects.requireNonNull(executor, "executor");
        this.context = Objects.requireNonNull(context, "context");
    }

    public int concurrency() {
        return concurrency;
    }

    /**
     * Executes every batch in order and shuts the workers down.
     *
     * @return number of modules scheduled
     * @throws InterruptedException when the control thread is interrupted while waiting
     */
    public int run(List<List<Module>> batches) throws InterruptedException {
        log.info("Setting up parallel execution with a concurrency of {}", concurrency);
        int total = batches.stream().mapToInt(List::size).sum();
        if (total == 0) {
            log.error("No modules provided to run or no modules able to run with the provided configuration and arguments.");
            return 0;
        }

        startWorkers(concurrency);
        int scheduled = 0;
        for (List<Module> batch : batches) {
            log.debug("Enqueueing batch {}", batch);
            for (Module module : batch) {
                log.info("module {}: Scheduling", module.qualifiedName());
                queue.put(new WorkItem(module));
                scheduled++;
            }
            log.info("All applicable modules queued. Waiting for completion");
            queue.awaitDrained();
        }

        log.info("All batches and work queue completed. Scheduling sentinels");
        for (int i = 0; i < workers.size(); i++) {
            queue.put(SHUTDOWN);
        }
        queue.awaitDrained();
        log.info("Sentinels cleared, joining workers");
        for (Thread worker : workers) {
            worker.join();
        }
        workers.clear();
        log.info("All workers completed.");
        return scheduled;
    }

    /**
     * Starts workers until {@code target} are running. Never stops workers.
     *
     * @return number of workers running
     */
    int startWorkers(int target) {
        while (workers.size() < target) {
            Thread worker = new Thread(this::work, "rescuekit-worker-" + workers.size());
            worker.setDaemon(true);
            workers.add(worker);
            worker.start();
        }
        return workers.size();
    }

    /** Workers currently started; zero outside of {@link #run}. */
    int workerCount() {
        return workers.size();
    }

    /**
     * Modules whose execution failed, in completion order.
     */
    public List<Module> failures() {
        return List.copyOf(failures);
    }

    private void work() {
        String identity = Thread.currentThread().getName();
        log.debug("Worker {} started", identity);
        while (true) {
            WorkItem item;
            try {
                item = queue.take();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                log.warn("Worker {} interrupted while waiting for work", identity);
                return;
            }
            if (item == SHUTDOWN) {
                log.debug("Worker {} exiting", identity);
                queue.taskDone();
                return;
            }
            try {
                execute(identity, item.module());
            } finally {
                queue.taskDone();
            }
        }
    }

    private void execute(String identity, Module module) {
        log.debug("Worker {} has module '{}'", identity, module.name());
        context.notifyModuleRunning(module);
        try {
            String output = executor.execute(module, context);
            context.writeModuleLog(module, output);
            log.debug("Worker {} completed module '{}'", identity, module.name());
        } catch (ModuleRunFailureException ex) {
            failures.add(module);
            context.writeModuleLog(module, ex.output());
            log.warn("module {}: {}", module.qualifiedName(), ex.getMessage());
        } catch (RuntimeException | Error ex) {
            // a dead worker would leave its shutdown marker untaken
            failures.add(module);
            log.error("module {}: unexpected error while running", module.qualifiedName(), ex);
        }
    }

    private record WorkItem(Module module) {}
}
