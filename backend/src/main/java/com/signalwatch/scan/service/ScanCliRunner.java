package com.signalwatch.scan.service;

import com.signalwatch.config.ScannerProperties;
import com.signalwatch.scan.model.Mismatch;
import com.signalwatch.scan.model.NetworkStatistics;
import com.signalwatch.scan.model.ScanBatchResult;
import com.signalwatch.scan.model.ScanRequest;
import com.signalwatch.scan.model.ScanResult;
import com.signalwatch.scan.model.ScanSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

@Component
public class ScanCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScanCliRunner.class);

    private final ScannerProperties properties;
    private final ScanOrchestratorService scanOrchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public ScanCliRunner(
        ScannerProperties properties,
        ScanOrchestratorService scanOrchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.scanOrchestratorService = scanOrchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        ScannerProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        List<String> companyNumbers = Arrays.stream(cli.getCompanyNumbers().split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();

        ScanRequest request = new ScanRequest(
            companyNumbers,
            cli.isScanNetwork(),
            cli.getNetworkDepth(),
            cli.isActiveDirectorsOnly(),
            cli.isUseAi(),
            true,
            null,
            null,
            null
        );

        ScanBatchResult batch = scanOrchestratorService.processCompanies(request);
        ScanSummary summary = batch.summary();
        log.info(
            "Scan completed: companies={}, withMismatches={}, mismatches={}, failed={}, fromCache={}",
            summary.totalCompanies(),
            summary.companiesWithMismatches(),
            summary.totalMismatches(),
            summary.failedCompanies(),
            summary.fromCache()
        );
        for (ScanResult result : batch.results()) {
            if (result.isError()) {
                log.info("Company {}: error {} ({})", result.companyNumber(), result.error().code(), result.error().message());
                continue;
            }
            log.info(
                "Company {} {}: documents={}, mismatches={}, warnings={}",
                result.companyNumber(),
                result.companyName(),
                result.documentsScanned(),
                result.mismatches().total(),
                result.warnings()
            );
            for (Mismatch mismatch : result.mismatches().mismatches()) {
                log.info("  [{}] {} in {}: {}", mismatch.severity().value(), mismatch.type().value(), mismatch.document(), mismatch.message());
            }
        }
        if (batch.network() != null) {
            NetworkStatistics stats = batch.network().statistics();
            log.info(
                "Network: companies={}, directors={}, connections={}, depthReached={}, warnings={}",
                stats.totalCompanies(),
                stats.totalDirectors(),
                stats.totalConnections(),
                stats.depthReached(),
                stats.warnings()
            );
        }

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
