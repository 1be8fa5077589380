package com.saletracker.tracker.application.controller.subscription.mapper;

import com.saletracker.tracker.application.controller.subscription.PriceResponse;
import com.saletracker.tracker.application.controller.subscription.SubscriptionResponse;
import com.saletracker.tracker.domain.price.PriceSnapshot;
import com.saletracker.tracker.domain.subscription.MonitoredItem;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface SubscriptionResponseMapper {

    @Mapping(target = "subscribers", ignore = true)
    SubscriptionResponse toResponse(MonitoredItem item);

    SubscriptionResponse toDetailedResponse(MonitoredItem item);

    PriceResponse toPriceResponse(PriceSnapshot snapshot);
}
