package net.kairos.app;

import net.kairos.core.model.Job;
import net.kairos.core.model.ListJobsRequest;
import net.kairos.core.model.ListJobsResponse;
import net.kairos.core.service.SchedulerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/** 기동 시 kairos.app.list-parent 아래 Job 을 페이지 단위로 모두 읽어 로그로 남긴다 */
@Component
@Order(10)
@ConditionalOnProperty(prefix = "kairos.app", name = "list-parent")
public class JobListingRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(JobListingRunner.class);

    private final SchedulerClient client;
    private final String parent;
    private final int pageSize;

    public JobListingRunner(SchedulerClient client,
                            @Value("${kairos.app.list-parent}") String parent,
                            @Value("${kairos.app.page-size:100}") int pageSize) {
        this.client = client;
        this.parent = parent;
        this.pageSize = pageSize;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<Job> jobs = listAll(parent);
        log.info("{} job(s) under {}", jobs.size(), parent);
    }

    public List<Job> listAll(String parent) {
        List<Job> all = new ArrayList<>();
        ListJobsRequest request = ListJobsRequest.firstPage(parent, pageSize);
        int page = 0;
        while (true) {
            ListJobsResponse response = client.listJobs(request);
            page++;
            for (Job job : response.jobs()) {
                log.info("[page {}] {} schedule='{}' tz={} state={}",
                        page, job.name(), job.schedule(), job.timeZone(), job.state());
                all.add(job);
            }
            if (!response.hasNextPage()) return all;
            request = request.nextPage(response.nextPageToken());
        }
    }
}
