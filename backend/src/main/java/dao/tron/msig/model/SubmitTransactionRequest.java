package dao.tron.msig.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class SubmitTransactionRequest {

    /** 2^256 - 1 */
    static final String MAX_UINT256 =
            "115792089237316195423570985008687907853269984665640564039457584007913129639935";

    @NotBlank
    private String destination;

    @NotBlank
    @Pattern(regexp = "\\d+", message = "must be a non-negative decimal integer")
    @DecimalMax(value = MAX_UINT256, message = "must fit in uint256")
    private String amount;          // string decimal, token's smallest unit
}
