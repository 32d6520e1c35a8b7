package hlsyde.scheduling;

import java.util.ArrayList;
import java.util.Collections;

/**
 * Runs ASAP and then pushes every operation as late as its consumers and the
 * schedule time allow, the last precedence level first.
 */
public class ALAPScheduler implements Scheduler, DataflowGraphMethods {

    private final ASAPScheduler asap = new ASAPScheduler();

    @Override
    public void applyScheduling(Schedule schedule) {
        asap.applyScheduling(schedule);
        if (schedule.scheduleTime() < 0) {
            schedule.fixScheduleTime(schedule.maxEndTime());
        }
        var levels = new ArrayList<>(precedenceList(schedule.graph()));
        Collections.reverse(levels);
        for (var level : levels) {
            for (var id : level) {
                long room = (long) schedule.scheduleTime() - schedule.endTime(id);
                long delta = Math.min(schedule.slacks(id).forward(), room);
                if (delta > 0) {
                    schedule.moveOperation(id, (int) delta);
                }
            }
        }
    }
}
