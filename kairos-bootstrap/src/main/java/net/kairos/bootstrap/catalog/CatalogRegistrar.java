package net.kairos.bootstrap.catalog;

import net.kairos.bootstrap.props.KairosProperties;
import net.kairos.core.model.*;
import net.kairos.core.rpc.RpcStatusException;
import net.kairos.core.rpc.StatusCode;
import net.kairos.core.service.SchedulerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 설정에 선언된 Job 을 원격 스케줄러에 맞춘다.
 * 없으면 생성, ALREADY_EXISTS 면 갱신, 그다음 paused 값에 따라 일시정지/재개.
 * 생성 재시도 중 앞선 시도가 반영돼 ALREADY_EXISTS 가 와도 같은 경로로 수렴한다.
 */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final SchedulerClient client;

    public CatalogRegistrar(SchedulerClient client) {
        this.client = client;
    }

    public List<Job> register(KairosProperties.Catalog catalog) {
        List<Job> result = new ArrayList<>();
        if (catalog.getJobs().isEmpty()) return result;
        if (catalog.getParent() == null || catalog.getParent().isBlank()) {
            throw new IllegalStateException("kairos.catalog.parent is required when jobs are declared");
        }
        for (var def : catalog.getJobs()) {
            result.add(upsert(catalog.getParent(), def));
        }
        return result;
    }

    private Job upsert(String parent, KairosProperties.JobDef def) {
        if (def.getName() == null || def.getSchedule() == null) {
            throw new IllegalArgumentException("job.name and job.schedule are required");
        }
        String name = def.getName().contains("/") ? def.getName() : JobNames.job(parent, def.getName());
        Job desired = Job.ofNew(name, def.getDescription(), def.getSchedule(), def.getTimeZone(), target(def));

        // 1) 생성, 이미 있으면 갱신
        Job saved;
        String action;
        try {
            saved = client.createJob(new CreateJobRequest(parent, desired));
            action = "created";
        } catch (RpcStatusException e) {
            if (e.code() != StatusCode.ALREADY_EXISTS) throw e;
            saved = client.updateJob(UpdateJobRequest.of(desired));
            action = "updated";
        }

        // 2) 상태 맞추기
        if (def.isPaused() && saved.state() != Job.State.PAUSED) {
            saved = client.pauseJob(new PauseJobRequest(name));
        } else if (!def.isPaused() && saved.state() == Job.State.PAUSED) {
            saved = client.resumeJob(new ResumeJobRequest(name));
        }

        log.info("Catalog registered: job='{}' {} state={}", name, action, saved.state());
        return saved;
    }

    private static JobTarget target(KairosProperties.JobDef def) {
        boolean http = def.getHttpUri() != null && !def.getHttpUri().isBlank();
        boolean pubsub = def.getPubsubTopic() != null && !def.getPubsubTopic().isBlank();
        if (http == pubsub) {
            throw new IllegalArgumentException("job '" + def.getName() + "' needs exactly one of http-uri or pubsub-topic");
        }
        return http
                ? HttpTarget.of(def.getHttpUri(), HttpTarget.Method.from(def.getHttpMethod()))
                : PubsubTarget.of(def.getPubsubTopic());
    }
}
