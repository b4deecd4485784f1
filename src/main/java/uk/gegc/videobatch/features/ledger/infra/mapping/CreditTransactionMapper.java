package uk.gegc.videobatch.features.ledger.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.videobatch.features.ledger.api.dto.CreditTransactionDto;
import uk.gegc.videobatch.features.ledger.domain.model.CreditTransaction;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface CreditTransactionMapper {
    CreditTransactionDto toDto(CreditTransaction entity);
}
