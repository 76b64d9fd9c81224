package com.aiwriter.schedule.config;

import com.aiwriter.schedule.core.model.ScheduleTarget;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Deployment-provided target of every scheduled job.
 *
 * <pre>
 * contentsched:
 *   target:
 *     group-ref: content-schedules
 *     target-ref: dispatch.scheduled-content
 *     role-ref: scheduler-invoke
 *     context: 24hr
 * </pre>
 *
 * <p>Read once at startup and turned into an immutable {@link ScheduleTarget}.</p>
 */
@ConfigurationProperties(prefix = "contentsched.target")
public class ScheduleTargetProperties {

    /** Job group that namespaces job names. */
    private String groupRef = "content-schedules";

    /** Subject the fired job publishes its payload to. */
    private String targetRef = "dispatch.scheduled-content";

    /** Role the scheduler acts under when invoking the target. */
    private String roleRef = "";

    /** Context tag stamped into every job payload. */
    private String context = "24hr";

    public ScheduleTarget toScheduleTarget() {
        return new ScheduleTarget(targetRef, roleRef, groupRef);
    }

    public String getGroupRef() { return groupRef; }
    public void setGroupRef(String groupRef) { this.groupRef = groupRef; }

    public String getTargetRef() { return targetRef; }
    public void setTargetRef(String targetRef) { this.targetRef = targetRef; }

    public String getRoleRef() { return roleRef; }
    public void setRoleRef(String roleRef) { this.roleRef = roleRef; }

    public String getContext() { return context; }
    public void setContext(String context) { this.context = context; }
}
