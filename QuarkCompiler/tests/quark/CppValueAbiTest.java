package quark;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

public class CppValueAbiTest {

  // Functions declared by the quark/quark.hpp runtime headers and its builtin library.
  static final ImmutableSet<String> RUNTIME_FUNCTIONS =
      ImmutableSet.of(
          "qv_int", "qv_float", "qv_string", "qv_bool", "qv_null", "qv_list", "qv_vector",
          "qv_dict", "qv_ok", "qv_err", "qv_func",
          "q_add", "q_sub", "q_mul", "q_div", "q_mod", "q_pow", "q_neg",
          "q_lt", "q_lte", "q_gt", "q_gte", "q_eq", "q_neq", "q_and", "q_or", "q_not", "q_truthy",
          "q_vec_add", "q_vec_sub", "q_vec_mul", "q_vec_div", "q_vec_push", "q_vec_sum",
          "q_vec_min", "q_vec_max", "q_vadd_inplace", "q_fillna", "q_astype",
          "q_push", "q_pop", "q_get", "q_set", "q_insert", "q_remove", "q_slice", "q_reverse",
          "q_dget", "q_dset", "q_dict_get", "q_dict_set", "q_member_get", "q_member_set",
          "q_is_ok", "q_result_value", "q_result_error", "q_len", "q_iter_get",
          "q_call0", "q_call1", "q_call2", "q_call3", "q_call4", "q_calln",
          "q_alloc_closure", "q_gc_init",
          "q_print", "q_println", "q_input", "q_str", "q_int", "q_float", "q_bool", "q_type",
          "q_range", "q_abs", "q_min", "q_max", "q_sum", "q_sqrt", "q_floor", "q_ceil",
          "q_round", "q_upper", "q_lower", "q_trim", "q_contains", "q_startswith",
          "q_endswith", "q_replace", "q_concat", "q_split");

  private final CppValueAbi abi = CppValueAbi.create();

  @Test
  public void stringsAreQuotedForCpp() {
    assertThat(abi.stringValue("say \"hi\"\n")).isEqualTo("qv_string(\"say \\\"hi\\\"\\n\")");
    assertThat(CppValueAbi.quote("a\\b\tc")).isEqualTo("\"a\\\\b\\tc\"");
    assertThat(CppValueAbi.quote("??=")).isEqualTo("\"\\?\\?=\"");
    assertThat(CppValueAbi.quote("\u0001")).isEqualTo("\"\\001\"");
  }

  @Test
  public void numericLiterals() {
    assertThat(abi.intValue("42")).isEqualTo("qv_int(42LL)");
    assertThat(abi.floatValue("2.5")).isEqualTo("qv_float(2.5)");
    assertThat(abi.floatValue(".5")).isEqualTo("qv_float(0.5)");
    assertThat(abi.floatValue("3.")).isEqualTo("qv_float(3.0)");
  }

  @Test
  public void identifiersAvoidReservedNames() {
    assertThat(abi.identifier("total")).isEqualTo("total");
    assertThat(abi.identifier("new")).isEqualTo("qk_new");
    assertThat(abi.identifier("main")).isEqualTo("qk_main");
    assertThat(abi.identifier("q_add")).isEqualTo("qk_q_add");
    assertThat(abi.identifier("_t0")).isEqualTo("qk__t0");
    assertThat(abi.identifier("QValue")).isEqualTo("qk_QValue");
  }

  @Test
  public void callForms() {
    assertThat(abi.dynamicCall("f", ImmutableList.of())).isEqualTo("q_call0(f)");
    assertThat(abi.dynamicCall("f", ImmutableList.of("a", "b"))).isEqualTo("q_call2(f, a, b)");
    assertThat(abi.dynamicCall("f", ImmutableList.of("a", "b", "c", "d", "e")))
        .isEqualTo("q_calln(f, 5, {a, b, c, d, e})");
    assertThat(abi.directCall("quark_fn_g", ImmutableList.of())).isEqualTo("quark_fn_g(nullptr)");
    assertThat(abi.builtinCall("len", ImmutableList.of("xs"))).isEqualTo("q_len(xs)");
  }

  @Test
  public void vectorOperatorsFallBackToScalarForms() {
    assertThat(abi.binary(TokenKind.PLUS, true, "a", "b")).isEqualTo("q_vec_add(a, b)");
    assertThat(abi.binary(TokenKind.PLUS, false, "a", "b")).isEqualTo("q_add(a, b)");
    assertThat(abi.binary(TokenKind.GTE, true, "a", "b")).isEqualTo("q_gte(a, b)");
  }

  @Test
  public void entryPointsIncludeBuiltins() {
    assertThat(abi.entryPoints()).containsAtLeast("q_print", "q_slice", "qv_func", "q_calln");
  }

  @Test
  public void entryPointsExistInRuntime() {
    assertThat(RUNTIME_FUNCTIONS).containsAtLeastElementsIn(abi.entryPoints());
    assertThat(abi.entryPoints()).containsNoneOf("q_to_vector", "q_is_err", "q_band");
  }

  @Test
  public void errorTestNegatesOkTest() {
    assertThat(abi.isErr("r")).isEqualTo("!q_is_ok(r)");
  }
}
