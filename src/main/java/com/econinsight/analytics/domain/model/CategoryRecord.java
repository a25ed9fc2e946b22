package com.econinsight.analytics.domain.model;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "dim_category")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategoryRecord {

    @Id
    private String categoryKey;

    private String categoryName;
    private String fredSeriesId;

    @Enumerated(EnumType.STRING)
    private CategoryType categoryType;
}
