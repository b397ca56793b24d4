package org.cataphract.runtime.upkeep;

import org.cataphract.runtime.audit.AuditSubsystem;
import org.cataphract.runtime.internal.services.RollService;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.RecruitmentProject;
import org.cataphract.runtime.rules.RuleSet;

import java.util.Collection;
import java.util.stream.Collectors;

public class RecruitmentStep extends PerEntityStep<RecruitmentProject> {

    public static final String NAME = "recruitment";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected Collection<RecruitmentProject> entities(Campaign campaign, RollService rolls) {
        return campaign.getProjects().values().stream()
                .filter(RecruitmentProject::isActive)
                .collect(Collectors.toList());
    }

    @Override
    protected String describe(RecruitmentProject project) {
        return "project:" + project.getId();
    }

    @Override
    protected AuditSubsystem subsystem() {
        return AuditSubsystem.RECRUITMENT;
    }

    @Override
    protected void applyTo(Campaign campaign, RuleSet rules, RecruitmentProject project, RollService rolls) {
        rules.recruitment().advance(campaign, project, rolls);
    }
}
