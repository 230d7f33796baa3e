package io.fieldledger.core.payload;

public record SuppliesDistributedAdd(String item, Long quantity) implements Payload, CounterDelta {
    @Override public String target() { return "metric:supplies:" + item; }
    @Override public long delta() { return quantity; }

    @Override
    public void validate(int schemaVersion) {
        Fields.requireText(item, "item");
        Fields.requirePositive(quantity, "quantity");
    }
}
