package com.jobsearchops.pipeline.external;

import com.jobsearchops.pipeline.model.DigestContext;
import com.jobsearchops.pipeline.model.DueFollowUp;
import com.jobsearchops.pipeline.model.PipelineSummaryRow;
import com.jobsearchops.pipeline.model.TodayQueueItem;

import java.util.Locale;

/**
 * Plain-text digest used when no AI summarizer bean is registered.
 */
public class TemplateDigestSummarizer implements DigestSummarizer {

    @Override
    public String summarize(DigestContext context) {
        StringBuilder out = new StringBuilder();
        out.append("Job search digest for ").append(context.date()).append('\n');

        out.append("\nToday's queue (").append(context.todayQueue().size()).append(")\n");
        for (TodayQueueItem item : context.todayQueue()) {
            out.append("- ").append(item.company()).append(" / ").append(item.roleTitle())
                .append(" [").append(item.stage().label()).append("]");
            if (item.nextAction() != null) {
                out.append(": ").append(item.nextAction());
                if (item.nextActionDate() != null) {
                    out.append(" (by ").append(item.nextActionDate()).append(')');
                }
            }
            out.append('\n');
        }

        out.append("\nFollow-ups due (").append(context.dueFollowUps().size()).append(")\n");
        for (DueFollowUp due : context.dueFollowUps()) {
            out.append("- ").append(due.contact().fullName()).append(": ").append(due.step().label())
                .append(" due since ").append(due.dueSince()).append('\n');
        }

        out.append("\nPipeline\n");
        for (PipelineSummaryRow row : context.pipelineSummary()) {
            out.append("- ").append(row.stage().label()).append(": ").append(row.count());
            if (row.averageFitScore() != null) {
                out.append(String.format(Locale.ROOT, " (avg fit %.1f)", row.averageFitScore()));
            }
            out.append('\n');
        }
        return out.toString();
    }
}
