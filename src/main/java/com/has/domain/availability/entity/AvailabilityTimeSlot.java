package com.has.domain.availability.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

@Table("availability_time_slots")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AvailabilityTimeSlot {

    @Id
    private Long id;

    private Long availabilityId;

    private Integer slotOrder;

    private String startTime;                // HH:mm
    private String endTime;                  // HH:mm

    private Boolean isAvailable;
}
