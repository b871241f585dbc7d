package io.barrister.tck;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import io.barrister.spec.BarristerErrorCodes;
import io.barrister.spec.JSONRPCError;

/**
 * Reference implementation of the conformance interface {@code A}.
 * <p>
 * Method names follow the IDL function names so that each binds as the capitalized
 * function name, e.g. {@code say_hi} binds as {@code Say_hi}.
 */
public class AImpl {

    public long add(long a, long b) {
        return a + b;
    }

    public double calc(List<Double> nums, MathOp operation) {
        switch (operation) {
            case ADD: {
                double sum = 0;
                for (double num : nums) {
                    sum += num;
                }
                return sum;
            }
            case MULTIPLY: {
                double product = 1;
                for (double num : nums) {
                    product *= num;
                }
                return product;
            }
            default:
                throw new JSONRPCError(BarristerErrorCodes.SERVER_ERROR_CODE, "Unknown operation: " + operation);
        }
    }

    public double sqrt(double a) {
        return Math.sqrt(a);
    }

    public RepeatResponse repeat(RepeatRequest req1) {
        String s = req1.forceUppercase() ? req1.toRepeat().toUpperCase(Locale.ROOT) : req1.toRepeat();
        List<String> items = new ArrayList<>();
        for (long i = 0; i < req1.count(); i++) {
            items.add(s);
        }
        return new RepeatResponse(Status.OK, req1.count(), items);
    }

    public HiResponse say_hi() {
        return new HiResponse("hi");
    }

    public List<Long> repeat_num(long num, long count) {
        List<Long> result = new ArrayList<>();
        for (long i = 0; i < count; i++) {
            result.add(num);
        }
        return result;
    }

    public String putPerson(Person p) {
        return p.personId();
    }
}
