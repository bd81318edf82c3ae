package works.rpycdec.pickle;

@FunctionalInterface
public interface SecurityPolicyListener {
	void onSubstitution(SecurityPolicyEvent event);

	SecurityPolicyListener IGNORE = event -> { };
}
