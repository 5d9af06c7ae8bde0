package work.blockscript.setting;

/**
 * Current value bound to a block parameter. Implementations: {@link FixedValue},
 * {@link VariableRef}, {@link Interpolated}, {@link ListValue} and {@link DictValue}.
 * Values are immutable and only turned into source text at generation time.
 */
public interface SettingValue {
}
