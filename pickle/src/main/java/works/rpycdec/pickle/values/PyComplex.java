package works.rpycdec.pickle.values;

public record PyComplex(double real, double imag) {
	@Override
	public String toString() {
		return "(" + real + (imag < 0 ? "-" : "+") + Math.abs(imag) + "j)";
	}
}
