package com.pharmasop.trigger.application.query;

import com.pharmasop.api.dto.SopJobDetailDTO;
import com.pharmasop.api.dto.SopJobPageDTO;
import com.pharmasop.domain.sop.adapter.repository.ISopJobRepository;
import com.pharmasop.domain.sop.model.entity.SopJobEntity;
import com.pharmasop.domain.sop.model.valobj.SopJobSearchCriteria;
import com.pharmasop.trigger.application.common.SopJobDetailViewAssembler;
import com.pharmasop.types.enums.PharmaDepartmentEnum;
import com.pharmasop.types.enums.RegulatoryFrameworkEnum;
import com.pharmasop.types.enums.SopJobStatusEnum;
import com.pharmasop.types.enums.SopPriorityEnum;
import com.pharmasop.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.function.Function;

/**
 * 作业查询用例：单作业查询与条件检索，只读，不改变任何状态。
 */
@Service
public class SopJobQueryService {

    private static final int MAX_PAGE_SIZE = 100;

    private final ISopJobRepository sopJobRepository;
    private final SopJobDetailViewAssembler sopJobDetailViewAssembler;

    public SopJobQueryService(ISopJobRepository sopJobRepository,
                              SopJobDetailViewAssembler sopJobDetailViewAssembler) {
        this.sopJobRepository = sopJobRepository;
        this.sopJobDetailViewAssembler = sopJobDetailViewAssembler;
    }

    public SopJobDetailDTO getJob(String jobId) {
        SopJobEntity job = StringUtils.isBlank(jobId) ? null : sopJobRepository.findByJobId(jobId.trim());
        if (job == null) {
            throw AppException.notFound("SOP job not found: " + jobId);
        }
        return sopJobDetailViewAssembler.toDetailDTO(job);
    }

    public SopJobPageDTO search(SearchQuery query) {
        SearchQuery source = query == null ? SearchQuery.empty() : query;
        SopJobSearchCriteria criteria = new SopJobSearchCriteria();
        criteria.setStatus(parse(source.status(), SopJobStatusEnum::fromCode, "status"));
        criteria.setDepartment(parse(source.department(), PharmaDepartmentEnum::fromCode, "department"));
        criteria.setPriority(parse(source.priority(), SopPriorityEnum::fromCode, "priority"));
        criteria.setFramework(parse(source.framework(), RegulatoryFrameworkEnum::fromCode, "framework"));
        criteria.setRequestedBy(StringUtils.trimToNull(source.requestedBy()));
        criteria.setCreatedFrom(source.createdFrom());
        criteria.setCreatedTo(source.createdTo());
        criteria.setMinScore(source.minScore());
        criteria.setIncludeArchived(Boolean.TRUE.equals(source.includeArchived()));
        criteria.setPage(source.page() == null || source.page() < 1 ? 1 : source.page());
        criteria.setSize(source.size() == null || source.size() < 1 ? 20 : Math.min(source.size(), MAX_PAGE_SIZE));
        if (criteria.getCreatedFrom() != null && criteria.getCreatedTo() != null
                && criteria.getCreatedFrom().isAfter(criteria.getCreatedTo())) {
            throw AppException.invalidRequest("createdFrom must not be after createdTo");
        }

        List<SopJobEntity> jobs = sopJobRepository.search(criteria);
        long total = sopJobRepository.count(criteria);
        SopJobPageDTO page = new SopJobPageDTO();
        page.setItems(sopJobDetailViewAssembler.toSummaryDTOs(jobs));
        page.setTotal(total);
        page.setPage(criteria.getPage());
        page.setSize(criteria.getSize());
        return page;
    }

    private <E> E parse(String code, Function<String, E> parser, String fieldName) {
        if (StringUtils.isBlank(code)) {
            return null;
        }
        try {
            return parser.apply(code.trim());
        } catch (IllegalArgumentException ex) {
            throw AppException.invalidRequest("Unknown " + fieldName + ": " + code);
        }
    }

    public record SearchQuery(String status,
                              String department,
                              String priority,
                              String framework,
                              String requestedBy,
                              LocalDateTime createdFrom,
                              LocalDateTime createdTo,
                              Integer minScore,
                              Boolean includeArchived,
                              Integer page,
                              Integer size) {
        public static SearchQuery empty() {
            return new SearchQuery(null, null, null, null, null, null, null, null, null, null, null);
        }
    }
}
