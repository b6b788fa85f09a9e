package com.shinobi.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Getter;

@Getter
public class CharacterUpdateRequest extends PatchRequest {

    @Size(min = 1, max = 100)
    @Pattern(regexp = NOT_BLANK, message = "must not be blank")
    private String name;

    @Size(min = 1, max = 50)
    @Pattern(regexp = NOT_BLANK, message = "must not be blank")
    private String village;

    @Size(max = 50)
    private String rank;

    public void setName(String name) {
        this.name = name;
        markPresent("name");
    }

    public void setVillage(String village) {
        this.village = village;
        markPresent("village");
    }

    public void setRank(String rank) {
        this.rank = rank;
        markPresent("rank");
    }
}
