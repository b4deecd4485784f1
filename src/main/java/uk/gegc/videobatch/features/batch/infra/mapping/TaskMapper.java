package uk.gegc.videobatch.features.batch.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;
import org.mapstruct.ReportingPolicy;
import uk.gegc.videobatch.features.batch.api.dto.TaskDto;
import uk.gegc.videobatch.features.batch.domain.model.TaskStatus;
import uk.gegc.videobatch.features.batch.domain.model.VideoTask;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface TaskMapper {

    @Mapping(target = "status", source = "status", qualifiedByName = "statusValue")
    TaskDto toDto(VideoTask entity);

    List<TaskDto> toDtos(List<VideoTask> entities);

    @Named("statusValue")
    default String statusValue(TaskStatus status) {
        return status != null ? status.value() : null;
    }
}
