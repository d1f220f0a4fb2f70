package blockwise.coordinator.graph;

import blockwise.coordinator.error.CyclicDependencyException;
import blockwise.coordinator.model.Block;
import blockwise.coordinator.model.BlockKey;
import blockwise.coordinator.model.Task;
import blockwise.coordinator.partition.BlockGrid;
import blockwise.coordinator.partition.BlockPartitioner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Task and block level dependencies of a run.
 * <p>
 * Tasks are ordered topologically (ties keep submission order). A block
 * depends on every block of an upstream task whose write region intersects
 * the block's read region, and, for tasks with read/write conflicts, on the
 * overlapping same-task blocks of a lower conflict level.
 * <p>
 * Built once before scheduling and read-only afterwards.
 */
public final class DependencyGraph {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraph.class);

    private final List<Task> tasks;
    private final Map<String, Task> taskById;
    private final Map<String, BlockGrid> grids;
    private final Map<BlockKey, List<BlockKey>> upstream = new HashMap<>();
    private final Map<BlockKey, List<BlockKey>> downstream = new HashMap<>();
    private final Map<String, List<String>> downstreamTasks = new HashMap<>();
    private final int totalBlocks;

    /**
     * @throws IllegalArgumentException   on duplicate task ids or unknown
     *                                    upstream ids
     * @throws CyclicDependencyException  if the tasks cannot be ordered
     */
    public DependencyGraph(List<Task> submitted) {
        Objects.requireNonNull(submitted, "tasks are required");
        if (submitted.isEmpty()) {
            throw new IllegalArgumentException("at least one task is required");
        }

        Map<String, Task> byId = new LinkedHashMap<>();
        for (Task task : submitted) {
            if (byId.put(task.id(), task) != null) {
                throw new IllegalArgumentException("duplicate task id: " + task.id());
            }
        }
        for (Task task : submitted) {
            for (String up : task.upstreamTaskIds()) {
                if (!byId.containsKey(up)) {
                    throw new IllegalArgumentException("task " + task.id() + " requires unknown task " + up);
                }
            }
        }
        this.taskById = Collections.unmodifiableMap(byId);
        this.tasks = Collections.unmodifiableList(topologicalOrder(submitted));

        Map<String, BlockGrid> partitioned = new LinkedHashMap<>();
        int blockCount = 0;
        for (Task task : tasks) {
            BlockGrid grid = BlockPartitioner.partition(task);
            partitioned.put(task.id(), grid);
            blockCount += grid.size();
            downstreamTasks.put(task.id(), new ArrayList<>());
        }
        this.grids = Collections.unmodifiableMap(partitioned);
        this.totalBlocks = blockCount;

        for (Task task : tasks) {
            for (String up : task.upstreamTaskIds()) {
                downstreamTasks.get(up).add(task.id());
            }
            linkBlocks(task);
        }

        log.info("Dependency graph: {} tasks, {} blocks, order {}",
                tasks.size(), totalBlocks, tasks.stream().map(Task::id).toList());
    }

    /**
     * Kahn's algorithm. Among tasks that are ready at the same time,
     * submission order wins.
     */
    static List<Task> topologicalOrder(List<Task> submitted) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Map<String, List<Task>> dependents = new HashMap<>();
        for (Task task : submitted) {
            inDegree.put(task.id(), task.upstreamTaskIds().size());
            for (String up : task.upstreamTaskIds()) {
                dependents.computeIfAbsent(up, k -> new ArrayList<>()).add(task);
            }
        }

        List<Task> order = new ArrayList<>(submitted.size());
        List<Task> remaining = new ArrayList<>(submitted);
        Deque<Task> ready = new ArrayDeque<>();
        for (Task task : submitted) {
            if (inDegree.get(task.id()) == 0) {
                ready.add(task);
            }
        }
        while (!ready.isEmpty()) {
            Task next = ready.poll();
            order.add(next);
            remaining.remove(next);
            List<Task> unlocked = new ArrayList<>();
            for (Task dependent : dependents.getOrDefault(next.id(), List.of())) {
                if (inDegree.merge(dependent.id(), -1, Integer::sum) == 0) {
                    unlocked.add(dependent);
                }
            }
            unlocked.sort((a, b) -> Integer.compare(submitted.indexOf(a), submitted.indexOf(b)));
            ready.addAll(unlocked);
        }

        if (!remaining.isEmpty()) {
            throw new CyclicDependencyException(remaining.stream().map(Task::id).toList());
        }
        return order;
    }

    private void linkBlocks(Task task) {
        BlockGrid grid = grids.get(task.id());
        boolean conflicts = task.config().readWriteConflict() && task.config().hasContext();

        for (Block block : grid.blocks()) {
            List<BlockKey> ups = new ArrayList<>();
            for (String upId : task.upstreamTaskIds()) {
                BlockGrid upGrid = grids.get(upId);
                if (upGrid.totalRoi().dims() != block.readRoi().dims()) {
                    throw new IllegalArgumentException("task " + task.id() + " and upstream task " + upId
                            + " differ in dimensions");
                }
                for (Block up : upGrid.blocksIntersecting(block.readRoi())) {
                    ups.add(up.key());
                }
            }
            if (conflicts) {
                int level = grid.conflictLevel(block);
                for (Block neighbour : grid.blocksIntersecting(block.readRoi())) {
                    if (grid.conflictLevel(neighbour) < level) {
                        ups.add(neighbour.key());
                    }
                }
            }
            if (!ups.isEmpty()) {
                upstream.put(block.key(), ups);
                for (BlockKey up : ups) {
                    downstream.computeIfAbsent(up, k -> new ArrayList<>()).add(block.key());
                }
            }
        }
    }

    /** Tasks in scheduling (topological) order. */
    public List<Task> tasks() {
        return tasks;
    }

    public Task task(String taskId) {
        Task task = taskById.get(taskId);
        if (task == null) {
            throw new IllegalArgumentException("unknown task: " + taskId);
        }
        return task;
    }

    public BlockGrid grid(String taskId) {
        BlockGrid grid = grids.get(taskId);
        if (grid == null) {
            throw new IllegalArgumentException("unknown task: " + taskId);
        }
        return grid;
    }

    public Block block(BlockKey key) {
        return grid(key.taskId()).block(key.blockId());
    }

    public int numBlocks(String taskId) {
        return grid(taskId).size();
    }

    public int totalBlocks() {
        return totalBlocks;
    }

    /** Blocks that must succeed before {@code key} may run. */
    public List<BlockKey> upstream(BlockKey key) {
        return Collections.unmodifiableList(upstream.getOrDefault(key, List.of()));
    }

    /** Blocks that wait on {@code key}. */
    public List<BlockKey> downstream(BlockKey key) {
        return Collections.unmodifiableList(downstream.getOrDefault(key, List.of()));
    }

    /** Ids of tasks that directly require {@code taskId}. */
    public List<String> downstreamTasks(String taskId) {
        return Collections.unmodifiableList(downstreamTasks.getOrDefault(taskId, List.of()));
    }

    /** Blocks with nothing upstream, in task order then block id order. */
    public List<Block> roots() {
        List<Block> roots = new ArrayList<>();
        for (Task task : tasks) {
            for (Block block : grids.get(task.id()).blocks()) {
                if (!upstream.containsKey(block.key())) {
                    roots.add(block);
                }
            }
        }
        return roots;
    }
}
