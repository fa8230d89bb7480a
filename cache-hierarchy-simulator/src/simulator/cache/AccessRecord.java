package simulator.cache;

/** One step of a trace: a read or write of a single byte address, taken as unsigned. */
public final class AccessRecord {
	public final Operation operation;
	public final long address;

	public AccessRecord(Operation operation, long address) {
		if (operation == null) {
			throw new IllegalArgumentException("operation is required");
		}
		this.operation = operation;
		this.address = address;
	}

	public static AccessRecord read(long address) {
		return new AccessRecord(Operation.READ, address);
	}

	public static AccessRecord write(long address) {
		return new AccessRecord(Operation.WRITE, address);
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof AccessRecord) {
			AccessRecord other = (AccessRecord) o;
			return operation == other.operation && address == other.address;
		}
		return false;
	}

	@Override
	public int hashCode() {
		return 31 * operation.hashCode() + Long.hashCode(address);
	}

	@Override
	public String toString() {
		return operation.token() + " " + BitTwiddle.hex(address);
	}
}
