package com.shinobi.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Getter;

@Getter
public class JutsuUpdateRequest extends PatchRequest {

    @Size(min = 1, max = 100)
    @Pattern(regexp = NOT_BLANK, message = "must not be blank")
    private String name;

    @Size(min = 1, max = 50)
    @Pattern(regexp = NOT_BLANK, message = "must not be blank")
    private String type;

    @Min(1)
    private Integer chakraCost;

    // explicit null detaches the jutsu from its character
    @Positive
    private Long characterId;

    public void setName(String name) {
        this.name = name;
        markPresent("name");
    }

    public void setType(String type) {
        this.type = type;
        markPresent("type");
    }

    public void setChakraCost(Integer chakraCost) {
        this.chakraCost = chakraCost;
        markPresent("chakraCost");
    }

    public void setCharacterId(Long characterId) {
        this.characterId = characterId;
        markPresent("characterId");
    }
}
