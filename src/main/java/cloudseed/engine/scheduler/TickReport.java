package cloudseed.engine.scheduler;

/**
 * Outcome of one orchestrator tick.
 *
 * @param examined  non-terminal tasks looked at
 * @param advanced  tasks whose record changed and was saved
 * @param failed    tasks that ended the tick in FAILED
 * @param skipped   tasks whose save was rejected because another writer moved them on
 */
public record TickReport(int examined, int advanced, int failed, int skipped) {

    public static TickReport empty() {
        return new TickReport(0, 0, 0, 0);
    }

    public boolean changedAnything() {
        return advanced > 0;
    }
}
