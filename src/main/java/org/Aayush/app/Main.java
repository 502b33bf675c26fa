package org.Aayush.app;

import org.Aayush.planner.core.OptimizerRuntimeConfig;
import org.Aayush.planner.core.ScheduleOptimizer;
import org.Aayush.planner.core.ScheduleResult;
import org.Aayush.planner.core.ScheduledOccurrence;

import java.io.PrintStream;

/**
 * Smoke-run entry point: optimizes the bundled programme and prints the schedule.
 */
public class Main {
    /**
     * Runs the optimizer with limits taken from system properties.
     *
     * @param args ignored.
     */
    public static void main(String[] args) {
        ScheduleOptimizer optimizer = ScheduleOptimizer.builder()
                .transitTable(SampleProgramme.transitTable())
                .runtimeConfig(OptimizerRuntimeConfig.defaults())
                .build();
        ScheduleResult result = optimizer.optimize(SampleProgramme.listings());
        print(result, System.out);
    }

    static void print(ScheduleResult result, PrintStream out) {
        out.println("attendance: " + result.getAttendance());
        out.println("transit: " + result.getTotalTransitMinutes() + "m");
        if (!result.isOptimal()) {
            out.println("(best found before " + result.getTerminationReason() + ", not proven optimal)");
        }
        for (ScheduledOccurrence entry : result.getEntries()) {
            if (entry.hasTransition()) {
                String transit = entry.isVenueChanged()
                        ? entry.getTransitMinutes() + "m to " + entry.getVenue()
                        : "none";
                out.println("   ... (transit: " + transit + ", downtime: " + entry.getDowntimeMinutes() + "m)");
            }
            out.println(entry.getStart() + " @ " + entry.getVenue() + ": \"" + entry.getTitle() + "\"");
        }
    }
}
