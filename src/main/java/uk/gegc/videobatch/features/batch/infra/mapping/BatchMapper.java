package uk.gegc.videobatch.features.batch.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.videobatch.features.batch.api.dto.BatchDto;
import uk.gegc.videobatch.features.batch.domain.model.Batch;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface BatchMapper {
    BatchDto toDto(Batch entity);
}
