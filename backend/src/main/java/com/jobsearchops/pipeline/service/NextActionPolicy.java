package com.jobsearchops.pipeline.service;

import com.jobsearchops.pipeline.model.NextAction;
import com.jobsearchops.pipeline.model.Stage;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-stage follow-up window applied after every stage change.
 */
public final class NextActionPolicy {
    private static final Map<Stage, Rule> RULES = new EnumMap<>(Stage.class);

    static {
        RULES.put(Stage.PROSPECT, new Rule("Research company and find a warm contact", 3));
        RULES.put(Stage.WARM_LEAD, new Rule("Follow up with contact and ask for a referral", 2));
        RULES.put(Stage.APPLIED, new Rule("Check application status and nudge recruiter", 7));
        RULES.put(Stage.RECRUITER_SCREEN, new Rule("Send thank-you note and confirm next steps", 2));
        RULES.put(Stage.HM_INTERVIEW, new Rule("Send thank-you note to hiring manager", 2));
        RULES.put(Stage.LOOP, new Rule("Follow up on loop feedback", 1));
        RULES.put(Stage.OFFER_PENDING, new Rule("Review offer and respond", 2));
    }

    private NextActionPolicy() {
    }

    /**
     * @return the next action for {@code stage} counted from {@code today}, or {@code null} for
     *     {@link Stage#CLOSED}, which clears both fields
     */
    public static NextAction nextActionFor(Stage stage, LocalDate today) {
        Rule rule = RULES.get(stage);
        if (rule == null) {
            return null;
        }
        return new NextAction(rule.text(), today.plusDays(rule.days()));
    }

    private record Rule(String text, int days) {
    }
}
