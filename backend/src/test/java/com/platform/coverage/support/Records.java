package com.platform.coverage.support;

import com.platform.coverage.model.ServerRecord;
import com.platform.coverage.model.VenStatus;
import com.platform.coverage.model.WorkloadRecord;

/**
 * Small builders for reconciliation fixtures.
 */
public final class Records {
    
    private Records() {
    }
    
    public static WorkloadRecord.WorkloadRecordBuilder workload(String hostnameKey) {
        return WorkloadRecord.builder()
            .href("/orgs/1/workloads/" + hostnameKey)
            .hostname(hostnameKey.toLowerCase())
            .hostnameNormalized(hostnameKey)
            .managed(true)
            .online(true)
            .venStatus(VenStatus.ACTIVE)
            .venStatusLabel("active")
            .venVersion("21.5")
            .enforcementMode("full");
    }
    
    public static WorkloadRecord.WorkloadRecordBuilder unmanaged(String hostnameKey) {
        return workload(hostnameKey)
            .managed(false)
            .online(false)
            .venStatus(VenStatus.UNMANAGED)
            .venStatusLabel("unmanaged")
            .venVersion("")
            .enforcementMode("");
    }
    
    public static ServerRecord.ServerRecordBuilder server(String hostnameKey) {
        return ServerRecord.builder()
            .sysId("sys-" + hostnameKey)
            .name(hostnameKey.toLowerCase())
            .hostname(hostnameKey.toLowerCase())
            .hostnameNormalized(hostnameKey);
    }
}
