package com.shinobi.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "jutsus", indexes = {
        @Index(name = "idx_jutsus_name", columnList = "name"),
        @Index(name = "idx_jutsus_character", columnList = "character_id")
})
public class Jutsu extends BaseEntity {

    public static final int DEFAULT_CHAKRA_COST = 10;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, length = 50)
    private String type;

    @Column(name = "chakra_cost", nullable = false)
    private Integer chakraCost = DEFAULT_CHAKRA_COST;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "character_id", foreignKey = @ForeignKey(name = "fk_jutsus_character"))
    private Character character;
}
