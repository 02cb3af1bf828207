package com.platform.coverage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Deployment Coverage Auditor
 * 
 * Compares the Illumio PCE workload inventory with the ServiceNow CMDB server inventory and
 * reports which servers carry a VEN:
 * - Concurrent, retrying extraction from both REST APIs
 * - Hostname-based reconciliation with coverage statistics
 * - Illumio-only analysis when the CMDB is unavailable
 * - JSON extracts of the reconciled inventory
 */
@SpringBootApplication
public class CoverageApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(CoverageApplication.class, args)));
    }
}
